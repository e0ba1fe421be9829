package com.family.library.conversation;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Dialog table for the running process. Readers share the lock, writers hold it
 * exclusively, and nothing but the map access happens while it is held.
 */
@Component
public class InMemoryConversationStateStore implements ConversationStateStore {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Long, ConversationState> states = new HashMap<>();

    @Override
    public Optional<ConversationState> get(long userId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(states.get(userId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void set(long userId, ConversationState state) {
        if (state == null) {
            throw new IllegalArgumentException("state must not be null");
        }
        lock.writeLock().lock();
        try {
            states.put(userId, state);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(long userId) {
        lock.writeLock().lock();
        try {
            states.remove(userId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return states.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
