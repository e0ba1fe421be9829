package com.family.library.controller;

import com.family.library.service.UserAuthorizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Checks the {@code initData} string a Telegram Mini App sends with every API call.
 * <ol>
 *   <li>secret = HMAC-SHA256(key "WebAppData", bot token)</li>
 *   <li>hash = hex HMAC-SHA256(key secret, sorted "k=v" lines without {@code hash})</li>
 *   <li>{@code auth_date} no older than {@link #MAX_AGE}</li>
 *   <li>the user id is on the allow-list</li>
 * </ol>
 */
@Component
public class InitDataValidator {

    private static final Logger log = LoggerFactory.getLogger(InitDataValidator.class);

    static final Duration MAX_AGE = Duration.ofHours(24);
    static final String SCHEME = "tma ";

    private static final String HMAC = "HmacSHA256";

    private final String botToken;
    private final UserAuthorizer authorizer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public InitDataValidator(@Value("${telegram.token:}") String botToken,
                             UserAuthorizer authorizer,
                             ObjectMapper objectMapper,
                             Clock clock) {
        this.botToken = StringUtils.trimToEmpty(botToken);
        this.authorizer = authorizer;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Validates an {@code Authorization: tma <initData>} header and returns the user id.
     */
    public long authenticate(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(SCHEME)) {
            throw new ServiceException(HttpStatus.UNAUTHORIZED, "missing tma authorization");
        }
        return validate(authorizationHeader.substring(SCHEME.length()).trim());
    }

    long validate(String initData) {
        if (botToken.isEmpty()) {
            throw new ServiceException(HttpStatus.SERVICE_UNAVAILABLE, "bot token not configured");
        }
        Map<String, String> fields = parse(initData);
        String hash = fields.remove("hash");
        if (StringUtils.isBlank(hash)) {
            throw new ServiceException(HttpStatus.UNAUTHORIZED, "init data has no hash");
        }

        String expected = sign(dataCheckString(fields));
        if (!MessageDigest.isEqual(expected.getBytes(StandardCharsets.US_ASCII),
                hash.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII))) {
            throw new ServiceException(HttpStatus.UNAUTHORIZED, "init data signature mismatch");
        }

        long authDate;
        try {
            authDate = Long.parseLong(StringUtils.defaultString(fields.get("auth_date")));
        } catch (NumberFormatException e) {
            throw new ServiceException(HttpStatus.UNAUTHORIZED, "init data has no auth_date");
        }
        long ageSeconds = clock.instant().getEpochSecond() - authDate;
        if (ageSeconds > MAX_AGE.getSeconds()) {
            throw new ServiceException(HttpStatus.UNAUTHORIZED, "init data expired");
        }

        long userId = userId(fields.get("user"));
        if (!authorizer.isAllowed(userId)) {
            log.debug("Mini App call from user {} (not on allow-list)", userId);
            throw new ServiceException(HttpStatus.FORBIDDEN, "user not allowed");
        }
        return userId;
    }

    static Map<String, String> parse(String initData) {
        Map<String, String> fields = new TreeMap<>();
        for (String pair : StringUtils.split(StringUtils.defaultString(initData), '&')) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            fields.put(key, value);
        }
        return fields;
    }

    static String dataCheckString(Map<String, String> fields) {
        return new TreeMap<>(fields).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("\n"));
    }

    String sign(String dataCheckString) {
        byte[] secret = hmac("WebAppData".getBytes(StandardCharsets.UTF_8), botToken);
        return HexFormat.of().formatHex(hmac(secret, dataCheckString));
    }

    private static byte[] hmac(byte[] key, String message) {
        try {
            Mac mac = Mac.getInstance(HMAC);
            mac.init(new SecretKeySpec(key, HMAC));
            return mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    private long userId(String userJson) {
        if (StringUtils.isBlank(userJson)) {
            throw new ServiceException(HttpStatus.UNAUTHORIZED, "init data has no user");
        }
        try {
            JsonNode user = objectMapper.readTree(userJson);
            JsonNode id = user.get("id");
            if (id == null || !id.canConvertToLong()) {
                throw new ServiceException(HttpStatus.UNAUTHORIZED, "init data user has no id");
            }
            return id.asLong();
        } catch (ServiceException e) {
            throw e;
        } catch (Exception e) {
            throw new ServiceException(HttpStatus.UNAUTHORIZED, "init data user is not valid JSON", e);
        }
    }
}
