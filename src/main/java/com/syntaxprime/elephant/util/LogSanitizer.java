package com.syntaxprime.elephant.util;

public final class LogSanitizer {
    // Control characters enable log injection and forged lines
    private static final java.util.regex.Pattern CONTROL_CHARS = java.util.regex.Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int MAX_VALUE_LENGTH = 80;

    private LogSanitizer() {
    }

    /**
     * Identifies a query in logs by length and hash only, so conversation text never reaches log output.
     */
    public static String querySummary(String query) {
        if (query == null) {
            return "[len=0,id=none]";
        }
        int len = query.length();
        String id = Integer.toHexString(query.hashCode());
        return "[len=" + len + ",id=" + id + "]";
    }

    /**
     * Strips control characters and caps length for short values such as titles and ids.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
        return cleaned.length() <= MAX_VALUE_LENGTH ? cleaned : cleaned.substring(0, MAX_VALUE_LENGTH) + "...";
    }
}
