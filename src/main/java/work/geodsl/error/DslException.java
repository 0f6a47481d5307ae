package work.geodsl.error;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base of every failure the kernel reports for an input line. Carries the error kind and the
 * offending command or label name so callers can localise the message themselves.
 */
public class DslException extends RuntimeException {
    private final ErrorKind kind;
    private final String subject;

    public DslException(ErrorKind kind, String subject, String message) {
        this(kind, subject, message, null);
    }

    public DslException(ErrorKind kind, String subject, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.subject = subject;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Command or label the failure is about, {@code null} when the whole line is at fault.
     */
    public String subject() {
        return subject;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("kind", kind.code());
        if (subject != null) {
            map.put("subject", subject);
        }
        map.put("message", getMessage());
        return map;
    }
}
