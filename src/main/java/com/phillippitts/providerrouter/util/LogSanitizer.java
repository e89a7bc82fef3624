package com.phillippitts.providerrouter.util;

/** Utility for log-safe rendering of provider error text, which may echo prompts or keys. */
public final class LogSanitizer {

    /** Default length of error text written to logs. */
    public static final int DEFAULT_MAX = 200;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    /**
     * Renders an error as {@code SimpleName: message}, truncated, single line.
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return "";
        }
        String msg = error.getMessage();
        String text = msg == null ? error.getClass().getSimpleName() : error.getClass().getSimpleName() + ": " + msg;
        return truncate(text.replace('\n', ' ').replace('\r', ' '), DEFAULT_MAX);
    }
}
