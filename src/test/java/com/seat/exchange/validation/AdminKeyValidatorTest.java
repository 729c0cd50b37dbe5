package com.seat.exchange.validation;

import com.seat.exchange.exceptions.ForbiddenException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdminKeyValidatorTest {

    @Test
    void matchingKeyPasses() {
        assertThatCode(() -> new AdminKeyValidator("s3cret").verify("s3cret")).doesNotThrowAnyException();
    }

    @Test
    void wrongOrMissingKeyIsForbidden() {
        AdminKeyValidator validator = new AdminKeyValidator("s3cret");

        assertThatThrownBy(() -> validator.verify("S3CRET")).isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> validator.verify(null)).isInstanceOf(ForbiddenException.class);
    }

    @Test
    void unsetSecretLocksTheSurface() {
        assertThatThrownBy(() -> new AdminKeyValidator("").verify("")).isInstanceOf(ForbiddenException.class);
    }
}
