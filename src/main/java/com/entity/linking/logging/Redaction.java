package com.entity.linking.logging;

import java.util.regex.Pattern;

/**
 * Masks identifiers and backend error text before they reach a log line or an API response.
 */
public final class Redaction {

    private static final int MAX_ERROR_LENGTH = 300;

    private static final Pattern EMAIL = Pattern.compile("[\\w.+-]+@([\\w-]+\\.[\\w.-]+)");
    private static final Pattern PHONE = Pattern.compile("\\+?\\d[\\d\\s().-]{6,}\\d");
    private static final Pattern BEARER = Pattern.compile("(?i)bearer\\s+[\\w.~+/=-]+");
    private static final Pattern URL_CREDENTIALS = Pattern.compile("(?i)(https?://)[^/@\\s]+@");

    private Redaction() {
        // utility class
    }

    /**
     * Keeps only the last two digits: {@code +61400123456} becomes {@code ***56}.
     */
    public static String maskPhone(String phone) {
        if (phone == null || phone.isBlank()) {
            return "<none>";
        }
        String digits = phone.replaceAll("\\D", "");
        return digits.length() <= 2 ? "***" : "***" + digits.substring(digits.length() - 2);
    }

    /**
     * Keeps only the domain: {@code alice@example.com} becomes {@code ***@example.com}.
     */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) {
            return "<none>";
        }
        int at = email.lastIndexOf('@');
        return at < 0 ? "***" : "***" + email.substring(at);
    }

    /**
     * Strips credentials, tokens, e-mail addresses and phone numbers from an error message
     * and caps its length.
     */
    public static String sanitizeError(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return sanitizeMessage(message);
    }

    public static String sanitizeMessage(String message) {
        if (message == null) {
            return "unknown error";
        }
        String cleaned = URL_CREDENTIALS.matcher(message).replaceAll("$1***@");
        cleaned = BEARER.matcher(cleaned).replaceAll("Bearer ***");
        cleaned = EMAIL.matcher(cleaned).replaceAll("***@$1");
        cleaned = PHONE.matcher(cleaned).replaceAll("***");
        if (cleaned.length() > MAX_ERROR_LENGTH) {
            cleaned = cleaned.substring(0, MAX_ERROR_LENGTH) + "...";
        }
        return cleaned;
    }
}
