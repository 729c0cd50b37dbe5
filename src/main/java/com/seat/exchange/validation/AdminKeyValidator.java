package com.seat.exchange.validation;

import com.seat.exchange.exceptions.ForbiddenException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Shared-secret check for the admin surface. An unset secret locks the surface entirely.
 */
@Slf4j
@Component
public class AdminKeyValidator {
    private final byte[] expected;

    public AdminKeyValidator(@Value("${exchange.admin.api-key:}") String apiKey) {
        this.expected = StringUtils.isBlank(apiKey) ? null : apiKey.getBytes(StandardCharsets.UTF_8);
        if (expected == null) {
            log.warn("exchange.admin.api-key is not set, admin endpoints will reject every call");
        }
    }

    public void verify(String providedKey) {
        if (expected == null || providedKey == null
                || !MessageDigest.isEqual(expected, providedKey.getBytes(StandardCharsets.UTF_8))) {
            throw new ForbiddenException("Invalid admin key");
        }
    }
}
