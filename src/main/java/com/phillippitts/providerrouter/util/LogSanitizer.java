package com.phillippitts.providerrouter.util;

/** Utility for log-safe rendering of caller-supplied identifiers. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Replaces control characters (CR, LF, tabs and the rest) with '_' and truncates to max
     * characters, so a feature or provider id taken from a request cannot forge log lines.
     */
    public static String sanitize(String s, int max) {
        String t = truncate(s, max);
        StringBuilder sb = new StringBuilder(t.length());
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            sb.append(Character.isISOControl(c) ? '_' : c);
        }
        return sb.toString();
    }
}
