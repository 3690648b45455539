package com.entity.linking.similarity;

import com.entity.linking.core.model.Endpoint;
import com.entity.linking.core.model.EndpointType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Canonical forms for phone numbers, e-mail addresses and names.
 */
public final class EndpointNormalizer {

    private EndpointNormalizer() {
        // utility class
    }

    /**
     * Reduces a phone number to its digits, dropping formatting and a leading {@code 00}
     * international dialling prefix. {@code "+61 (400) 123-456"} becomes {@code "61400123456"}.
     */
    public static String normalizePhone(String phone) {
        if (phone == null) {
            return "";
        }
        StringBuilder digits = new StringBuilder(phone.length());
        for (int i = 0; i < phone.length(); i++) {
            char c = phone.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        String result = digits.toString();
        if (result.startsWith("00")) {
            result = result.substring(2);
        }
        return result;
    }

    /**
     * Trims and lower-cases an e-mail address.
     */
    public static String normalizeEmail(String email) {
        if (email == null) {
            return "";
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the domain part of a normalized e-mail address, or an empty string when there is none.
     */
    public static String emailDomain(String email) {
        String normalized = normalizeEmail(email);
        int at = normalized.lastIndexOf('@');
        if (at < 0 || at == normalized.length() - 1) {
            return "";
        }
        return normalized.substring(at + 1);
    }

    /**
     * Lower-cases a name and collapses punctuation and whitespace runs to single spaces.
     */
    public static String normalizeName(String name) {
        if (name == null) {
            return "";
        }
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}]+", " ")
                .trim();
    }

    public static List<String> nameTokens(String name) {
        String normalized = normalizeName(name);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return new ArrayList<>(Arrays.asList(normalized.split(" ")));
    }

    /**
     * Builds an endpoint with its normalized form filled in.
     */
    public static Endpoint endpoint(EndpointType type, String value) {
        String normalized = type == EndpointType.PHONE ? normalizePhone(value) : normalizeEmail(value);
        return new Endpoint(type, value, normalized);
    }
}
