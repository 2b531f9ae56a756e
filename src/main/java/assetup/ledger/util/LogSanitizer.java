package assetup.ledger.util;

import java.util.regex.Pattern;

/**
 * Makes caller supplied values safe for log statements. Control characters
 * are replaced to prevent log injection and account addresses can be shortened.
 */
public final class LogSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\r\\n\\t]+");

    private LogSanitizer() {
        // Utility class
    }

    /**
     * Replaces control characters with underscores.
     *
     * @param value caller provided value, may be null
     * @return sanitized value, empty for null
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("_");
    }

    /**
     * Shortens an account address to its first six and last four characters,
     * e.g. {@code 0x1234...abcd}. Short values are masked entirely.
     */
    public static String maskAddress(String address) {
        String sanitized = sanitize(address);
        if (sanitized.isEmpty()) {
            return "";
        }
        if (sanitized.length() <= 10) {
            return sanitized.charAt(0) + "***";
        }
        return sanitized.substring(0, 6) + "..." + sanitized.substring(sanitized.length() - 4);
    }
}
