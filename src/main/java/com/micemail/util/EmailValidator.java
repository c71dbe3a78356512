package com.micemail.util;

import java.util.regex.Pattern;

/**
 * Syntactic email address check (no DNS lookup)
 */
public final class EmailValidator {

    // Dot-separated local atoms; domain labels ending in a 2+ letter TLD
    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^[A-Z0-9_+-]+(\\.[A-Z0-9_+-]+)*@([A-Z0-9][A-Z0-9-]*\\.)+[A-Z]{2,}$",
            Pattern.CASE_INSENSITIVE);

    private EmailValidator() {}

    /**
     * Check address syntax. Never throws; null and empty are invalid.
     */
    public static boolean isValid(String address) {
        if (address == null || address.isEmpty()) {
            return false;
        }
        return EMAIL_PATTERN.matcher(address).matches();
    }
}
