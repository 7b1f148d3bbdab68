package monops.batchengine.util;

import java.util.regex.Pattern;

/**
 * Helpers that make user controlled values and remote error messages safe for logs and
 * for the error column of an item record. Control characters are flattened so a crafted
 * revert reason cannot inject log lines.
 */
public final class LogSanitizer {

    public static final int MAX_ERROR_LENGTH = 500;

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\r\\n\\t]+");

    private LogSanitizer() {
        // Utility class
    }

    /**
     * Removes control characters that could be abused for log injection.
     *
     * @param value User provided value
     * @return Sanitized value safe for log statements
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("_");
    }

    /**
     * Masks an account or contract address, keeping the prefix and the last four characters.
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

    /**
     * Builds the message stored on a failed item: sanitized, defaulted and capped at
     * {@link #MAX_ERROR_LENGTH} characters.
     */
    public static String errorMessage(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            message = error.getClass().getSimpleName();
        }
        return truncate(sanitize(message), MAX_ERROR_LENGTH);
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
