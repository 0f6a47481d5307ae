package work.geodsl.construction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.geodsl.error.CircularDefinitionException;
import work.geodsl.error.InvalidArgumentException;
import work.geodsl.error.UndefinedLabelException;
import work.geodsl.parser.Literal;
import work.geodsl.parser.ParsedExpression;
import work.geodsl.parser.Reference;
import work.geodsl.value.DslValue;
import work.geodsl.value.ScalarValue;

class ConstructionTest {
    private static final ParsedExpression ONE = new Literal(ScalarValue.of(1));

    // Each element's value is 1 + the sum of its dependencies.
    private static final Recomputation SUM = (element, staged) -> {
        double total = 1;
        for (String dependency : element.dependencies()) {
            total += ((ScalarValue) staged.resolve(dependency).orElseThrow()).value();
        }
        return ScalarValue.of(total);
    };

    @Test
    void defineMaintainsReverseEdges() {
        var construction = diamond();
        assertEquals(Set.of("B", "C"), construction.dependentsOf("A"));
        assertEquals(Set.of("D"), construction.dependentsOf("B"));
        assertEquals(Set.of("B", "C"), construction.element("D").orElseThrow().dependencies());
        assertTrue(construction.element("A").orElseThrow().isIndependent());
        assertEquals(List.of("A", "B", "C", "D"), List.copyOf(construction.labels()));
    }

    @Test
    void defineRejectsBoundAndUnknownLabels() {
        var construction = diamond();
        assertThrows(IllegalStateException.class, () -> construction.define("A", ONE, ScalarValue.of(1), Set.of()));
        assertThrows(UndefinedLabelException.class, () -> construction.define("E", ONE, ScalarValue.of(1), Set.of("X")));
        assertThrows(CircularDefinitionException.class, () -> construction.define("E", ONE, ScalarValue.of(1), Set.of("E")));
        assertEquals(4, construction.size());
    }

    @Test
    void transitiveDependentsAreTopologicallyOrdered() {
        var construction = diamond();
        construction.define("E", new Reference("D"), ScalarValue.of(5), Set.of("D", "A"));
        assertEquals(List.of("B", "C", "D", "E"), construction.transitiveDependents("A"));
        assertEquals(List.of("D", "E"), construction.transitiveDependents("C"));
        assertEquals(List.of(), construction.transitiveDependents("E"));
    }

    @Test
    void redefineRecomputesEveryDependentAfterItsInputs() {
        var construction = diamond();
        List<String> order = new ArrayList<>();
        Recomputation recording = (element, staged) -> {
            order.add(element.label());
            return SUM.recompute(element, staged);
        };

        List<String> recomputed = construction.redefine("A", ONE, ScalarValue.of(10), Set.of(), recording);

        assertEquals(List.of("B", "C", "D"), recomputed);
        assertEquals(recomputed, order);
        assertEquals(ScalarValue.of(10), construction.resolve("A").orElseThrow());
        assertEquals(ScalarValue.of(11), construction.resolve("B").orElseThrow());
        assertEquals(ScalarValue.of(11), construction.resolve("C").orElseThrow());
        assertEquals(ScalarValue.of(23), construction.resolve("D").orElseThrow());
    }

    @Test
    void cycleIsRejectedBeforeAnyMutation() {
        var construction = diamond();
        DslValue before = construction.resolve("A").orElseThrow();

        var ex = assertThrows(
            CircularDefinitionException.class,
            () -> construction.redefine("A", new Reference("D"), ScalarValue.of(99), Set.of("D"), SUM)
        );

        assertEquals("A", ex.subject());
        assertEquals(before, construction.resolve("A").orElseThrow());
        assertTrue(construction.element("A").orElseThrow().dependencies().isEmpty());
        assertTrue(construction.dependentsOf("D").isEmpty());
        assertEquals(ONE, construction.element("A").orElseThrow().definition());
    }

    @Test
    void selfReferenceIsACycle() {
        var construction = diamond();
        assertThrows(
            CircularDefinitionException.class,
            () -> construction.redefine("B", new Reference("B"), ScalarValue.of(1), Set.of("B"), SUM)
        );
    }

    @Test
    void failedRecomputationLeavesGraphUntouched() {
        var construction = diamond();
        Recomputation failOnD = (element, staged) -> {
            if (element.label().equals("D")) {
                throw new InvalidArgumentException("Sum", "boom");
            }
            return SUM.recompute(element, staged);
        };

        assertThrows(
            InvalidArgumentException.class,
            () -> construction.redefine("A", ONE, ScalarValue.of(10), Set.of(), failOnD)
        );

        assertEquals(ScalarValue.of(1), construction.resolve("A").orElseThrow());
        assertEquals(ScalarValue.of(2), construction.resolve("B").orElseThrow());
        assertEquals(ScalarValue.of(5), construction.resolve("D").orElseThrow());
    }

    @Test
    void redefineMovesReverseEdges() {
        var construction = diamond();
        construction.define("X", ONE, ScalarValue.of(1), Set.of());

        construction.redefine("B", new Reference("X"), ScalarValue.of(2), Set.of("X"), SUM);

        assertEquals(Set.of("C"), construction.dependentsOf("A"));
        assertEquals(Set.of("B"), construction.dependentsOf("X"));
        assertEquals(Set.of("X"), construction.element("B").orElseThrow().dependencies());
        assertEquals("X", construction.element("B").orElseThrow().definitionText());
    }

    @Test
    void clearRemovesEverything() {
        var construction = diamond();
        construction.clear();
        assertTrue(construction.isEmpty());
        assertTrue(construction.resolve("A").isEmpty());
    }

    // A <- B, A <- C, {B, C} <- D with values 1, 2, 2, 5.
    private static Construction diamond() {
        var construction = new Construction();
        construction.define("A", ONE, ScalarValue.of(1), Set.of());
        construction.define("B", new Reference("A"), ScalarValue.of(2), Set.of("A"));
        construction.define("C", new Reference("A"), ScalarValue.of(2), Set.of("A"));
        construction.define("D", new Reference("B"), ScalarValue.of(5), Set.of("B", "C"));
        return construction;
    }
}
