package com.family.library.service;

/**
 * Decides whether a messaging user may talk to the bot at all.
 */
public interface UserAuthorizer {

    boolean isAllowed(long userId);
}
