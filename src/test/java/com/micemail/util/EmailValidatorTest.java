package com.micemail.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * EmailValidator unit tests
 */
class EmailValidatorTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "a@b.co",
            "user@example.com",
            "first.last@mail.example.org",
            "user+tag@example.io",
            "under_score-dash@sub-domain.example.net",
            "USER@EXAMPLE.COM"
    })
    @DisplayName("Well-formed addresses are accepted")
    void testValidAddresses(String address) {
        assertThat(EmailValidator.isValid(address)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "plainaddress",
            "user@localhost",
            "user@example.c",
            "user@example.c0m",
            "@example.com",
            "user@",
            ".user@example.com",
            "user.@example.com",
            "us..er@example.com",
            "user@-example.com",
            "user@example..com",
            "user name@example.com",
            " user@example.com"
    })
    @DisplayName("Malformed addresses are rejected")
    void testInvalidAddresses(String address) {
        assertThat(EmailValidator.isValid(address)).isFalse();
    }

    @Test
    @DisplayName("null is rejected without throwing")
    void testNull() {
        assertThat(EmailValidator.isValid(null)).isFalse();
    }

    @Test
    @DisplayName("Long non-matching local part fails fast")
    void testNoCatastrophicBacktracking() {
        String address = "a".repeat(5000) + "!@example.com";
        assertThat(EmailValidator.isValid(address)).isFalse();
    }
}
