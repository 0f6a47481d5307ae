package work.geodsl.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.geodsl.support.KernelTestSupport.assertObject;
import static work.geodsl.support.KernelTestSupport.assertPoint;
import static work.geodsl.support.KernelTestSupport.assertScalar;
import static work.geodsl.support.KernelTestSupport.kernel;
import static work.geodsl.support.KernelTestSupport.value;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.geodsl.algorithm.StandardAlgorithms;
import work.geodsl.config.KernelConfiguration;
import work.geodsl.error.ArgumentCountException;
import work.geodsl.error.CircularDefinitionException;
import work.geodsl.error.CommandDisallowedException;
import work.geodsl.error.CommandNotFoundException;
import work.geodsl.error.ErrorKind;
import work.geodsl.error.InvalidArgumentException;
import work.geodsl.error.InvalidInputException;
import work.geodsl.error.NameUsedException;
import work.geodsl.error.UndefinedLabelException;
import work.geodsl.parser.CommandCall;
import work.geodsl.value.DslValue;
import work.geodsl.value.ObjectValue;
import work.geodsl.value.PointValue;
import work.geodsl.value.ScalarValue;

class KernelTest {
    @Test
    void assignmentRoundTrip() {
        var kernel = kernel("A = Point(1, 2)");
        DslValue direct = value(kernel, "Point(1, 2)");
        assertEquals(direct, kernel.lookup("A").orElseThrow());
        assertEquals(direct, value(kernel, "A"));
    }

    @Test
    void reevaluationIsIdempotent() {
        var kernel = kernel("A = (0, 0)", "B = (2, 1)");
        DslValue first = value(kernel, "Line(A, B)");
        DslValue second = value(kernel, "Line(A, B)");
        assertEquals(first, second);
        assertEquals(Set.of("A", "B"), kernel.elements().keySet());
    }

    @Test
    void arityBoundary() {
        var kernel = kernel("A = (0, 0)", "B = (1, 1)", "C = (2, 2)");
        var tooFew = assertThrows(ArgumentCountException.class, () -> kernel.evaluate("Segment(A)"));
        assertEquals(ErrorKind.ARGUMENT_COUNT, tooFew.kind());
        assertThrows(ArgumentCountException.class, () -> kernel.evaluate("Segment(A, B, C)"));
        assertObject("Segment", value(kernel, "Segment(A, B)"));
    }

    @Test
    void cycleRejectionKeepsPriorValues() {
        var kernel = kernel("A = Point(1, 2)", "B = Translate(A, (1, 1))");

        var ex = assertThrows(CircularDefinitionException.class, () -> kernel.evaluate("A = Translate(B, (1, 1))"));

        assertEquals("A", ex.subject());
        assertPoint(1, 2, kernel.lookup("A").orElseThrow());
        assertPoint(2, 3, kernel.lookup("B").orElseThrow());
        assertEquals(Set.of("B"), kernel.dependentsOf("A"));
        assertTrue(kernel.dependentsOf("B").isEmpty());
    }

    @Test
    void safeRedefinitionRecomputesDependents() {
        var kernel = kernel("A = Point(1, 2)", "B = Point(3, 4)", "C = Line(A, B)");
        String before = kernel.construction().element("C").orElseThrow().definitionText();

        LineResult result = kernel.evaluate("A = Point(5, 6)");

        assertEquals(List.of("C"), result.recomputed());
        ObjectValue line = assertObject("Line", kernel.lookup("C").orElseThrow());
        assertPoint(5, 6, line.property("point1").orElseThrow());
        assertPoint(3, 4, line.property("point2").orElseThrow());
        assertEquals(before, kernel.construction().element("C").orElseThrow().definitionText());
        assertTrue(kernel.lookup("C").orElseThrow().display().startsWith("Line[(5, 6), (3, 4)"));
    }

    @Test
    void transitiveDependentsFollowRedefinition() {
        var kernel = kernel("A = (0, 0)", "B = (4, 0)", "s = Segment(A, B)", "M = Midpoint(s)", "d = Distance(M, B)");

        kernel.evaluate("B = (8, 0)");

        assertPoint(4, 0, kernel.lookup("M").orElseThrow());
        assertScalar(4, kernel.lookup("d").orElseThrow());
    }

    @Test
    void failingRecomputationRollsBack() {
        var kernel = kernel("A = (0, 0)", "B = (4, 0)", "g = Line(A, B)");

        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("A = (4, 0)"));

        assertPoint(0, 0, kernel.lookup("A").orElseThrow());
        assertPoint(0, 0, ((ObjectValue) kernel.lookup("g").orElseThrow()).property("point1").orElseThrow());
    }

    @Test
    void unknownCommandLeavesGraphUnchanged() {
        var kernel = kernel("A = (1, 1)");
        Map<String, DslValue> before = kernel.elements();

        var ex = assertThrows(CommandNotFoundException.class, () -> kernel.evaluate("Q = Foo(1, 2)"));

        assertEquals("Foo", ex.subject());
        assertEquals(before, kernel.elements());
    }

    @Test
    void undefinedReferenceLeavesGraphUnchanged() {
        var kernel = kernel();
        var ex = assertThrows(UndefinedLabelException.class, () -> kernel.evaluate("g = Line(X, Y)"));
        assertEquals(ErrorKind.UNDEFINED_LABEL, ex.kind());
        assertTrue(kernel.elements().isEmpty());
    }

    @Test
    void processNeverThrowsAndLogsErrors() {
        var kernel = Kernel.create(KernelConfiguration.defaults(), StandardAlgorithms.create(), new ErrorLog(true));

        LineResult ok = kernel.process("A = (1, 2)");
        LineResult bad = kernel.process("Foo(1)");
        LineResult empty = kernel.process("");

        assertTrue(ok.isSuccess());
        assertEquals("A = (1, 2)", ok.display());
        assertFalse(bad.isSuccess());
        assertEquals(ErrorKind.COMMAND_NOT_FOUND, bad.error().kind());
        assertEquals("CommandNotFoundError: Unknown command: Foo", bad.display());
        assertEquals(ErrorKind.INVALID_INPUT, empty.error().kind());
        assertEquals(2, kernel.errorLog().errors().size());
        assertEquals("Foo(1): Unknown command: Foo", kernel.errorLog().errors().get(0));
    }

    @Test
    void brokenPluginIsReportedAsInternal() {
        var kernel = Kernel.create(KernelConfiguration.defaults(), StandardAlgorithms.create(), new ErrorLog(true));
        kernel.addInputFilter(expression -> {
            throw new IllegalStateException("filter broke");
        });

        LineResult result = kernel.process("A = (1, 2)");

        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.INTERNAL, result.error().kind());
        assertEquals("InternalError: Internal error: filter broke", result.display());
        assertEquals(List.of("A = (1, 2): Internal error: filter broke"), kernel.errorLog().errors());
        assertTrue(kernel.elements().isEmpty());
    }

    @Test
    void redefinitionCanBeDisabled() {
        var config = KernelConfiguration.builder().allowRedefinition(false).build();
        var kernel = kernel(config, "A = (1, 2)");

        var ex = assertThrows(NameUsedException.class, () -> kernel.evaluate("A = (3, 4)"));

        assertEquals(ErrorKind.NAME_USED, ex.kind());
        assertPoint(1, 2, kernel.lookup("A").orElseThrow());
        assertEquals(List.of("Name already used: A"), kernel.validate("A = (5, 5)"));
    }

    @Test
    void examModeOnlyRunsAllowedCommands() {
        var config = KernelConfiguration.builder()
            .examMode(true)
            .allowedCommands(List.of("Point", "Segment"))
            .build();
        var kernel = kernel(config, "A = Point(0, 0)", "B = Point(1, 0)");

        assertObject("Segment", value(kernel, "Segment(A, B)"));
        var ex = assertThrows(CommandDisallowedException.class, () -> kernel.evaluate("Line(A, B)"));
        assertEquals("not permitted in exam mode", ex.reason());
        assertTrue(kernel.context().isExamMode());
    }

    @Test
    void casIsBlockedUnlessAllowed() {
        var blocked = kernel();
        assertThrows(CommandDisallowedException.class, () -> blocked.evaluate("Solve(1)"));

        var allowed = kernel(KernelConfiguration.builder().casAllowed(true).build());
        var ex = assertThrows(CommandNotFoundException.class, () -> allowed.evaluate("Solve(1)"));
        assertTrue(ex.getMessage().contains("no algorithm bound"));
    }

    @Test
    void maxArgumentsCapsEveryCommand() {
        var kernel = kernel(KernelConfiguration.builder().maxArguments(3).build());
        assertScalar(6, value(kernel, "Sum(1, 2, 3)"));
        var ex = assertThrows(ArgumentCountException.class, () -> kernel.evaluate("Sum(1, 2, 3, 4)"));
        assertEquals("0..3", ex.expected());
    }

    @Test
    void macrosReplaceLeafAlgorithms() {
        var kernel = kernel();
        kernel.registerAlgorithm("Rotate", (command, args, deps) -> AlgorithmResult.of(args.get(0)));

        assertPoint(1, 2, value(kernel, "Rotate((1, 2), 90)"));
        assertTrue(kernel.construction().isEmpty());
        assertThrows(CommandNotFoundException.class, () -> kernel.registerAlgorithm("Spin", (c, a, d) -> null));
    }

    @Test
    void validateReportsWithoutEvaluating() {
        var kernel = kernel("A = (0, 0)");
        assertEquals(List.of(), kernel.validate("Line(A, (1, 1))"));
        assertEquals(
            List.of("Unknown command: Foo", "Undefined variable: X"),
            kernel.validate("g = Foo(A, X)")
        );
        assertEquals(1, kernel.validate("Line(A").size());
        assertEquals(Set.of("A"), kernel.elements().keySet());
    }

    @Test
    void inputFiltersRejectWholeLines() {
        var kernel = kernel();
        kernel.addInputFilter(expression -> !(expression instanceof CommandCall call) || !call.name().equals("Sum"));

        assertThrows(InvalidInputException.class, () -> kernel.evaluate("Sum(1, 2)"));
        assertScalar(2, value(kernel, "Mean(1, 3)"));
    }

    @Test
    void plainExpressionsDoNotBind() {
        var kernel = kernel();
        LineResult result = kernel.evaluate("Mean(1, 2, 3)");
        assertFalse(result.isAssignment());
        assertEquals(ScalarValue.of(2), result.value());
        assertTrue(kernel.elements().isEmpty());
    }

    @Test
    void clearTearsDownSession() {
        var kernel = kernel("A = (1, 1)", "B = Vector(A)");
        kernel.clear();
        assertTrue(kernel.elements().isEmpty());
        assertTrue(kernel.lookup("A").isEmpty());
        assertEquals(PointValue.of(1, 1), value(kernel, "A = (1, 1)"));
    }

    @Test
    void lineResultSerialises() {
        var kernel = kernel("A = (1, 2)");
        Map<String, Object> map = kernel.evaluate("B = Midpoint(A, (3, 4))").toMap();
        assertEquals("ok", map.get("status"));
        assertEquals("B", map.get("label"));
        assertEquals(Map.of("type", "Point", "x", 2L, "y", 3L), map.get("value"));
        assertEquals(List.of("A"), map.get("dependencies"));
    }
}
