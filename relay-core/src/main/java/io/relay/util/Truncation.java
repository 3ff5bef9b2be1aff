package io.relay.util;

/**
 * Length limits for free-text columns (response bodies, error messages).
 */
public final class Truncation {
    public static final int MAX_TEXT_LENGTH = 4000;

    private Truncation() {
    }

    /**
     * Truncates {@code text} to {@link #MAX_TEXT_LENGTH} characters, ending in {@code "..."}
     * when shortened. {@code null} stays {@code null}.
     */
    public static String truncate(String text) {
        return truncate(text, MAX_TEXT_LENGTH);
    }

    public static String truncate(String text, int maxLength) {
        if (maxLength < 4) {
            throw new IllegalArgumentException("maxLength must be >= 4");
        }
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
