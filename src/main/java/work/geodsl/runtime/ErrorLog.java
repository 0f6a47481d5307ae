package work.geodsl.runtime;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.geodsl.error.DslException;

/**
 * Collects the messages of rejected lines for one session.
 */
public final class ErrorLog {
    private static final Logger LOG = LoggerFactory.getLogger(ErrorLog.class);

    private final boolean silent;
    private final List<String> errors = new ArrayList<>();

    public ErrorLog() {
        this(false);
    }

    public ErrorLog(boolean silent) {
        this.silent = silent;
    }

    public void record(String input, DslException error) {
        String message = input == null || input.isBlank() ? error.getMessage() : input + ": " + error.getMessage();
        errors.add(message);
        if (!silent) {
            LOG.warn("{} rejected: {}", error.kind().code(), message);
        }
    }

    public List<String> errors() {
        return List.copyOf(errors);
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public void clear() {
        errors.clear();
    }
}
