package com.family.library.service;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Fixed allow-list of user ids from {@code telegram.allowed-user-ids} (comma separated).
 * An empty list admits nobody.
 */
@Service
public class AllowListAuthorizer implements UserAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(AllowListAuthorizer.class);

    private final Set<Long> allowed;

    public AllowListAuthorizer(@Value("${telegram.allowed-user-ids:}") String allowedUserIds) {
        this.allowed = Collections.unmodifiableSet(parse(allowedUserIds));
        if (allowed.isEmpty()) {
            log.warn("telegram.allowed-user-ids is empty; every update will be dropped");
        } else {
            log.info("Allow-list loaded | users={}", allowed.size());
        }
    }

    static Set<Long> parse(String csv) {
        Set<Long> ids = new HashSet<>();
        for (String part : StringUtils.split(StringUtils.defaultString(csv), ',')) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                ids.add(Long.parseLong(trimmed));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid user id in telegram.allowed-user-ids: '" + trimmed + "'", e);
            }
        }
        return ids;
    }

    @Override
    public boolean isAllowed(long userId) {
        return allowed.contains(userId);
    }

    public Set<Long> getAllowed() {
        return allowed;
    }
}
