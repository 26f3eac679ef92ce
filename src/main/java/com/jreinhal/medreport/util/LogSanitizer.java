package com.jreinhal.medreport.util;

public final class LogSanitizer {
    // Control characters enable log injection/forging.
    private static final java.util.regex.Pattern CONTROL_CHARS = java.util.regex.Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int VISIBLE_SUFFIX = 3;

    private LogSanitizer() {
    }

    /**
     * Strip control characters from caller-supplied values before they enter log output.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
    }

    /**
     * Masks a patient national id down to its last three characters.
     */
    public static String maskNationalId(String nationalId) {
        if (nationalId == null || nationalId.isEmpty()) {
            return "[none]";
        }
        String cleaned = sanitize(nationalId);
        if (cleaned.length() <= VISIBLE_SUFFIX) {
            return "*".repeat(cleaned.length());
        }
        return "*".repeat(cleaned.length() - VISIBLE_SUFFIX) + cleaned.substring(cleaned.length() - VISIBLE_SUFFIX);
    }
}
