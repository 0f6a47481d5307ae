package work.geodsl.algorithm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.geodsl.support.KernelTestSupport.assertScalar;
import static work.geodsl.support.KernelTestSupport.kernel;
import static work.geodsl.support.KernelTestSupport.value;

import org.junit.jupiter.api.Test;
import work.geodsl.error.ArgumentTypeException;
import work.geodsl.error.ErrorKind;
import work.geodsl.error.InvalidArgumentException;
import work.geodsl.runtime.Kernel;

class AlgebraAlgorithmsTest {
    private final Kernel kernel = kernel();

    @Test
    void modTakesTheSignOfTheDivisor() {
        assertScalar(1, value(kernel, "Mod(7, 3)"));
        assertScalar(2, value(kernel, "Mod(-7, 3)"));
        assertScalar(0.5, value(kernel, "Mod(5.5, 1)"));
    }

    @Test
    void divFloors() {
        assertScalar(2, value(kernel, "Div(7, 3)"));
        assertScalar(-3, value(kernel, "Div(-7, 3)"));
    }

    @Test
    void divisionByZeroIsAnIllegalArgument() {
        var ex = assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Div(1, 0)"));
        assertEquals(ErrorKind.ILLEGAL_ARGUMENT, ex.kind());
        assertEquals("Div: division by zero", ex.getMessage());
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Mod(1, 0)"));
    }

    @Test
    void minAndMaxAcceptNumbersAndLists() {
        assertScalar(-2, value(kernel, "Min(3, -2, 5)"));
        assertScalar(7, value(kernel, "Max([1, 7], 4)"));
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Max((1, 2))"));
    }

    @Test
    void gcdAndLcm() {
        assertScalar(6, value(kernel, "GCD(12, 18)"));
        assertScalar(4, value(kernel, "GCD([8, -12, 20])"));
        assertScalar(36, value(kernel, "LCM(12, 18)"));
        assertScalar(0, value(kernel, "LCM(4, 0)"));
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("GCD(1.5, 3)"));
    }

    @Test
    void shapeFilterRejectsNonNumbers() {
        assertThrows(ArgumentTypeException.class, () -> kernel.evaluate("Mod((1, 2), 3)"));
    }
}
