package work.geodsl.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.geodsl.runtime.LineResult;
import work.geodsl.value.DslValue;

/**
 * Outcome of a {@link DslRunner} batch (usable by the CLI and embedding apps).
 */
public record RunResult(
    Status status,
    List<LineResult> lines,
    Map<String, DslValue> elements,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();
    private static final ObjectWriter YAML_WRITER = new YAMLMapper().writer();

    public RunResult {
        lines = List.copyOf(lines);
        elements = Collections.unmodifiableMap(new LinkedHashMap<>(elements));
    }

    static RunResult of(List<LineResult> lines, Map<String, DslValue> elements, Instant startedAt) {
        boolean failed = lines.stream().anyMatch(line -> !line.isSuccess());
        return new RunResult(failed ? Status.FAILURE : Status.SUCCESS, lines, elements, startedAt, Instant.now());
    }

    public long failures() {
        return lines.stream().filter(line -> !line.isSuccess()).count();
    }

    public Map<String, Object> toSerializableMap() {
        List<Object> serializedLines = new ArrayList<>(lines.size());
        for (LineResult line : lines) {
            serializedLines.add(line.toMap());
        }
        Map<String, Object> serializedElements = new LinkedHashMap<>();
        for (var entry : elements.entrySet()) {
            serializedElements.put(entry.getKey(), entry.getValue().toPlain());
        }
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("failures", failures());
        serializable.put("lines", serializedLines);
        serializable.put("elements", serializedElements);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return JSON_WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public String toYaml() {
        try {
            return YAML_WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "status: error\nmessage: \"" + ex.getMessage() + "\"\n";
        }
    }

    /**
     * One line per input, as a console would echo it.
     */
    public String toText() {
        StringBuilder out = new StringBuilder();
        for (LineResult line : lines) {
            out.append(line.display()).append(System.lineSeparator());
        }
        return out.toString();
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
