package work.geodsl.filter;

import java.util.Objects;

/**
 * Read-only context handed to every filter: the session mode token and whether labels may be
 * rebound.
 */
public record FilterContext(String mode, boolean allowRedefinition) {
    public static final String DEFAULT_MODE = "default";
    public static final String EXAM_MODE = "exam";

    public FilterContext {
        Objects.requireNonNull(mode, "mode");
    }

    public static FilterContext defaults() {
        return new FilterContext(DEFAULT_MODE, true);
    }

    public boolean isExamMode() {
        return EXAM_MODE.equals(mode);
    }
}
