package lockerhub.util;

/**
 * String helpers for values written to bounded columns.
 */
public final class Strings {
    public static final int MAX_ERROR_LENGTH = 4000;

    private Strings() {
    }

    /**
     * Truncates {@code text} to {@code maxLength} characters; {@code null} stays {@code null}.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }

    public static String truncateError(String error) {
        return truncate(error, MAX_ERROR_LENGTH);
    }
}
