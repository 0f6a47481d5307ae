package work.geodsl.algorithm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.geodsl.support.KernelTestSupport.kernel;
import static work.geodsl.support.KernelTestSupport.value;

import org.junit.jupiter.api.Test;
import work.geodsl.error.ArgumentTypeException;
import work.geodsl.error.InvalidArgumentException;
import work.geodsl.runtime.Kernel;
import work.geodsl.value.ListValue;
import work.geodsl.value.PointValue;
import work.geodsl.value.ScalarValue;
import work.geodsl.value.TextValue;

class ListAlgorithmsTest {
    private final Kernel kernel = kernel("L = [5, 3, 8, 1]");

    @Test
    void firstAndLast() {
        assertEquals(numbers(5), value(kernel, "First(L)"));
        assertEquals(numbers(5, 3, 8), value(kernel, "First(L, 3)"));
        assertEquals(numbers(8, 1), value(kernel, "Last(L, 2)"));
        assertEquals(numbers(), value(kernel, "Last(L, 0)"));
        assertEquals(numbers(), value(kernel, "First([])"));
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("First(L, 5)"));
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Last(L, 1.5)"));
        assertThrows(ArgumentTypeException.class, () -> kernel.evaluate("First(3)"));
    }

    @Test
    void appendAtEitherEnd() {
        assertEquals(numbers(5, 3, 8, 1, 2), value(kernel, "Append(L, 2)"));
        assertEquals(numbers(0, 5, 3, 8, 1), value(kernel, "Append(0, L)"));
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Append(1, 2)"));
    }

    @Test
    void sortsNumbersTextsAndPoints() {
        assertEquals(numbers(1, 3, 5, 8), value(kernel, "Sort(L)"));
        assertEquals(
            ListValue.of(new TextValue("a"), new TextValue("b")),
            value(kernel, "Sort([\"b\", \"a\"])")
        );
        assertEquals(
            ListValue.of(PointValue.of(1, 1), PointValue.of(1, 2), PointValue.of(2, 0)),
            value(kernel, "Sort([(2, 0), (1, 2), (1, 1)])")
        );
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Sort([1, \"a\"])"));
    }

    @Test
    void sortsByKeys() {
        assertEquals(
            ListValue.of(new TextValue("b"), new TextValue("c"), new TextValue("a")),
            value(kernel, "Sort([\"a\", \"b\", \"c\"], [3, 1, 2])")
        );
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Sort(L, [1, 2])"));
    }

    private static ListValue numbers(double... values) {
        ScalarValue[] items = new ScalarValue[values.length];
        for (int i = 0; i < values.length; i++) {
            items[i] = ScalarValue.of(values[i]);
        }
        return ListValue.of(items);
    }
}
