package work.geodsl.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.geodsl.config.KernelConfiguration;
import work.geodsl.runtime.Kernel;
import work.geodsl.runtime.LineResult;

/**
 * Public entry point for running a script of input lines against a fresh kernel. Blank lines and
 * lines starting with {@code #} are skipped.
 */
public final class DslRunner {
    private static final Logger LOG = LoggerFactory.getLogger(DslRunner.class);

    public RunResult run(List<String> lines, KernelConfiguration configuration, boolean failFast) {
        return run(Kernel.create(configuration), lines, failFast);
    }

    public RunResult run(Kernel kernel, List<String> lines, boolean failFast) {
        var started = Instant.now();
        List<LineResult> results = new ArrayList<>();
        for (String line : lines) {
            if (line == null || line.isBlank() || line.strip().startsWith("#")) {
                continue;
            }
            LineResult result = kernel.process(line.strip());
            results.add(result);
            if (!result.isSuccess() && failFast) {
                LOG.debug("Stopping after first failure: {}", line);
                break;
            }
        }
        return RunResult.of(results, kernel.elements(), started);
    }

    public RunResult runFile(Path script, KernelConfiguration configuration, boolean failFast) {
        try {
            return run(Files.readAllLines(script), configuration, failFast);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read script " + script + ": " + ex.getMessage(), ex);
        }
    }
}
