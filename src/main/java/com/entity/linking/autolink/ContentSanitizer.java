package com.entity.linking.autolink;

/**
 * Prepares message content for use as a search query: control characters become spaces,
 * whitespace runs collapse, and the result is trimmed and capped.
 */
public final class ContentSanitizer {

    private ContentSanitizer() {
        // utility class
    }

    /**
     * @param content   raw message body, may be null
     * @param maxLength maximum length of the returned query
     * @return the sanitized query, possibly empty
     */
    public static String toSearchQuery(String content, int maxLength) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(Math.min(content.length(), maxLength + 16));
        boolean lastWasSpace = true;
        for (int i = 0; i < content.length() && out.length() < maxLength; i++) {
            char c = content.charAt(i);
            boolean space = Character.isWhitespace(c) || Character.isISOControl(c)
                    || Character.getType(c) == Character.FORMAT;
            if (space) {
                if (!lastWasSpace) {
                    out.append(' ');
                    lastWasSpace = true;
                }
            } else {
                out.append(c);
                lastWasSpace = false;
            }
        }
        return out.toString().trim();
    }
}
