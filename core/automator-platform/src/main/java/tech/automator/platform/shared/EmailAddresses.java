package tech.automator.platform.shared;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Email normalization and syntax checks shared by login, registration and admin writes.
 */
public final class EmailAddresses {

    private static final Pattern SYNTAX = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private EmailAddresses() {
    }

    /**
     * Trim and lowercase. Returns null for null input.
     */
    public static String normalize(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isValid(String email) {
        return email != null && SYNTAX.matcher(email).matches();
    }
}
