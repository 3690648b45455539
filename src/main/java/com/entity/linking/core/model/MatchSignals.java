package com.entity.linking.core.model;

/**
 * Query signals for contact matching. Blank values count as absent.
 */
public record MatchSignals(String phone, String email, String name) {

    public MatchSignals {
        phone = blankToNull(phone);
        email = blankToNull(email);
        name = blankToNull(name);
    }

    public static MatchSignals none() {
        return new MatchSignals(null, null, null);
    }

    public static MatchSignals ofPhone(String phone) {
        return new MatchSignals(phone, null, null);
    }

    public static MatchSignals ofEmail(String email) {
        return new MatchSignals(null, email, null);
    }

    public static MatchSignals ofName(String name) {
        return new MatchSignals(null, null, name);
    }

    public boolean hasPhone() {
        return phone != null;
    }

    public boolean hasEmail() {
        return email != null;
    }

    public boolean hasName() {
        return name != null;
    }

    public boolean isEmpty() {
        return !hasPhone() && !hasEmail() && !hasName();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
