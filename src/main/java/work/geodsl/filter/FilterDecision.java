package work.geodsl.filter;

import java.util.Objects;
import work.geodsl.error.ErrorKind;

/**
 * Outcome of a filter check. A denial names the reason and the error kind to report.
 */
public record FilterDecision(boolean allowed, ErrorKind kind, String reason) {
    private static final FilterDecision ALLOW = new FilterDecision(true, null, null);

    public FilterDecision {
        if (!allowed) {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(reason, "reason");
        }
    }

    public static FilterDecision allow() {
        return ALLOW;
    }

    public static FilterDecision deny(ErrorKind kind, String reason) {
        return new FilterDecision(false, kind, reason);
    }

    public boolean denied() {
        return !allowed;
    }
}
