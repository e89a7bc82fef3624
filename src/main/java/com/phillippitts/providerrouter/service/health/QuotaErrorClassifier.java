package com.phillippitts.providerrouter.service.health;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Recognizes provider errors that signal exhausted prepaid credit, quota or billing problems.
 *
 * <p>Matching is a case-insensitive substring test over the message of the error and each of its causes.
 */
public final class QuotaErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 8;

    private final List<String> patterns;

    public QuotaErrorClassifier(List<String> patterns) {
        Objects.requireNonNull(patterns, "patterns");
        this.patterns = patterns.stream()
                .filter(p -> p != null && !p.isBlank())
                .map(p -> p.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    public boolean isQuotaError(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            String msg = current.getMessage();
            if (msg != null && matches(msg.toLowerCase(Locale.ROOT))) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private boolean matches(String lowerCaseMessage) {
        for (String p : patterns) {
            if (lowerCaseMessage.contains(p)) {
                return true;
            }
        }
        return false;
    }
}
