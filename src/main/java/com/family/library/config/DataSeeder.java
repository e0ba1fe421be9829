package com.family.library.config;

import com.family.library.entity.Participant;
import com.family.library.storage.LibraryStorage;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Seeds participants from {@code library.seed.participants}, e.g. {@code Alice:child,Bob:child,Mom:parent}.
 * Names already present are left alone.
 */
@Configuration
public class DataSeeder {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    @Bean
    CommandLineRunner seedParticipants(LibraryStorage storage,
                                       @Value("${library.seed.participants:}") String seed) {
        return args -> {
            Map<String, Boolean> wanted = parse(seed);
            if (wanted.isEmpty()) {
                return;
            }
            Set<String> existing = storage.listParticipants().stream()
                    .map(Participant::getName)
                    .collect(Collectors.toSet());
            int added = 0;
            for (Map.Entry<String, Boolean> entry : wanted.entrySet()) {
                if (existing.contains(entry.getKey())) {
                    continue;
                }
                storage.addParticipant(entry.getKey(), entry.getValue());
                added++;
            }
            if (added == 0) {
                log.info("Participants already seeded, skipping");
            } else {
                log.info("Seeded {} participant(s)", added);
            }
        };
    }

    /**
     * Name to parent flag, in declaration order.
     */
    static Map<String, Boolean> parse(String seed) {
        Map<String, Boolean> result = new LinkedHashMap<>();
        for (String entry : StringUtils.split(StringUtils.defaultString(seed), ',')) {
            String name = StringUtils.trimToEmpty(StringUtils.substringBefore(entry, ":"));
            String role = StringUtils.trimToEmpty(StringUtils.substringAfter(entry, ":"));
            if (name.isEmpty()) {
                continue;
            }
            if (!role.isEmpty() && !"child".equalsIgnoreCase(role) && !"parent".equalsIgnoreCase(role)) {
                throw new IllegalArgumentException("Unknown role '" + role + "' for participant " + name);
            }
            result.put(name, "parent".equalsIgnoreCase(role));
        }
        return result;
    }
}
