package work.geodsl.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.geodsl.error.DslException;
import work.geodsl.value.DslValue;

/**
 * Outcome of one input line: either a value (bound to {@code label} for assignments) or the
 * error that rejected the line.
 */
public record LineResult(
    String input,
    String label,
    DslValue value,
    Set<String> dependencies,
    List<String> recomputed,
    DslException error
) {
    public LineResult {
        dependencies = dependencies == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        recomputed = recomputed == null ? List.of() : List.copyOf(recomputed);
    }

    public static LineResult success(String input, String label, Evaluation evaluation, List<String> recomputed) {
        return new LineResult(input, label, evaluation.value(), evaluation.dependencies(), recomputed, null);
    }

    public static LineResult failure(String input, DslException error) {
        return new LineResult(input, null, null, Set.of(), List.of(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isAssignment() {
        return label != null;
    }

    public String display() {
        if (!isSuccess()) {
            return error.kind().code() + ": " + error.getMessage();
        }
        return isAssignment() ? label + " = " + value.display() : value.display();
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("input", input);
        if (isSuccess()) {
            map.put("status", "ok");
            if (label != null) {
                map.put("label", label);
            }
            map.put("value", value.toPlain());
            map.put("display", display());
            if (!dependencies.isEmpty()) {
                map.put("dependencies", new ArrayList<>(dependencies));
            }
            if (!recomputed.isEmpty()) {
                map.put("recomputed", recomputed);
            }
        } else {
            map.put("status", "error");
            map.put("error", error.toMap());
        }
        return map;
    }
}
