package work.geodsl.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.geodsl.support.KernelTestSupport.assertObject;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.geodsl.config.KernelConfiguration;

class DslRunnerTest {
    private final DslRunner runner = new DslRunner();

    @Test
    void runsScriptFile() {
        var script = Path.of("src", "test", "resources", "scripts", "triangle.geo");

        RunResult result = runner.runFile(script, KernelConfiguration.defaults(), false);

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals(6, result.lines().size());
        assertEquals(List.of("A", "B", "C", "t", "c", "M"), List.copyOf(result.elements().keySet()));
        assertObject("Circle", result.elements().get("c"));
    }

    @Test
    void reportsFailuresAndKeepsGoing() {
        RunResult result = runner.run(
            List.of("A = (1, 2)", "B = Foo(A)", "C = Translate(A, (1, 0))"),
            KernelConfiguration.defaults(),
            false
        );

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertEquals(1, result.failures());
        assertEquals(3, result.lines().size());
        assertEquals(List.of("A", "C"), List.copyOf(result.elements().keySet()));
    }

    @Test
    void failFastStopsAtFirstRejectedLine() {
        RunResult result = runner.run(
            List.of("A = (1, 2)", "Segment(A)", "C = (0, 0)"),
            KernelConfiguration.defaults(),
            true
        );

        assertEquals(2, result.lines().size());
        assertEquals(List.of("A"), List.copyOf(result.elements().keySet()));
    }

    @Test
    void serialisesToJson() throws Exception {
        RunResult result = runner.run(List.of("A = (1, 2)", "Div(1, 0)"), KernelConfiguration.defaults(), false);

        @SuppressWarnings("unchecked")
        Map<String, Object> json = new ObjectMapper().readValue(result.toPrettyJson(), Map.class);

        assertEquals("failure", json.get("status"));
        @SuppressWarnings("unchecked")
        var lines = (List<Map<String, Object>>) json.get("lines");
        assertEquals("ok", lines.get(0).get("status"));
        @SuppressWarnings("unchecked")
        var error = (Map<String, Object>) lines.get(1).get("error");
        assertEquals("IllegalArgumentError", error.get("kind"));
        assertEquals("Div", error.get("subject"));
        @SuppressWarnings("unchecked")
        var elements = (Map<String, Object>) json.get("elements");
        assertEquals(Map.of("type", "Point", "x", 1, "y", 2), elements.get("A"));
    }

    @Test
    void rendersYamlAndText() {
        RunResult result = runner.run(List.of("A = (1, 2)", "Mean(1, 2)"), KernelConfiguration.defaults(), false);

        assertTrue(result.toYaml().contains("status:"), result.toYaml());
        assertTrue(result.toYaml().contains("success"), result.toYaml());
        assertEquals("A = (1, 2)" + System.lineSeparator() + "1.5" + System.lineSeparator(), result.toText());
    }
}
