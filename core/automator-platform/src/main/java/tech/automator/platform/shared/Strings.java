package tech.automator.platform.shared;

/**
 * Null-tolerant string helpers for request values.
 */
public final class Strings {

    private Strings() {
    }

    /**
     * Trimmed value, or null when the input is null or blank.
     */
    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
