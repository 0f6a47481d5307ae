package work.geodsl.algorithm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.geodsl.support.KernelTestSupport.assertObject;
import static work.geodsl.support.KernelTestSupport.assertPoint;
import static work.geodsl.support.KernelTestSupport.assertScalar;
import static work.geodsl.support.KernelTestSupport.kernel;
import static work.geodsl.support.KernelTestSupport.value;

import org.junit.jupiter.api.Test;
import work.geodsl.error.InvalidArgumentException;
import work.geodsl.runtime.Kernel;
import work.geodsl.value.ListValue;
import work.geodsl.value.ObjectValue;

class GeometryAlgorithmsTest {
    private final Kernel kernel = kernel("A = (0, 0)", "B = (4, 0)", "C = (0, 3)");

    @Test
    void pointFromCoordinatesOrTuple() {
        assertPoint(1, 2, value(kernel, "Point(1, 2)"));
        assertPoint(1, 2, value(kernel, "Point((1, 2))"));
        assertPoint(3, 4, value(kernel, "Point([3, 4])"));
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Point(\"x\")"));
    }

    @Test
    void lineThroughTwoPointsOrParallel() {
        ObjectValue line = assertObject("Line", value(kernel, "Line(A, C)"));
        assertPoint(0, 3, line.property("point2").orElseThrow());
        assertTrue(line.property("slope").isEmpty());

        kernel.evaluate("g = Line(A, B)");
        ObjectValue parallel = assertObject("Line", value(kernel, "Line(C, g)"));
        assertPoint(4, 3, parallel.property("point2").orElseThrow());
        assertScalar(0, parallel.property("slope").orElseThrow());

        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Line(A, (0, 0))"));
    }

    @Test
    void segmentAndRay() {
        ObjectValue segment = assertObject("Segment", value(kernel, "Segment(B, C)"));
        assertScalar(5, segment.property("length").orElseThrow());

        ObjectValue ray = assertObject("Ray", value(kernel, "Ray(A, Vector((1, 1)))"));
        assertPoint(1, 1, ray.property("point2").orElseThrow());
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Ray(A, A)"));
    }

    @Test
    void circleByRadiusPointOrThreePoints() {
        ObjectValue byRadius = assertObject("Circle", value(kernel, "Circle(A, 2)"));
        assertScalar(2, byRadius.property("radius").orElseThrow());
        assertScalar(4 * Math.PI, byRadius.property("area").orElseThrow());

        assertScalar(4, assertObject("Circle", value(kernel, "Circle(A, B)")).property("radius").orElseThrow());

        ObjectValue circumcircle = assertObject("Circle", value(kernel, "Circle(A, B, C)"));
        assertPoint(2, 1.5, circumcircle.property("center").orElseThrow());
        assertScalar(2.5, circumcircle.property("radius").orElseThrow());

        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Circle(A, -1)"));
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Circle(A, (1, 1), (2, 2))"));
    }

    @Test
    void midpointOfPointsSegmentsAndPolygons() {
        assertPoint(2, 0, value(kernel, "Midpoint(A, B)"));
        assertPoint(2, 1.5, value(kernel, "Midpoint(Segment(B, C))"));
        assertPoint(4.0 / 3, 1, value(kernel, "Midpoint(Polygon(A, B, C))"));
        assertPoint(0, 0, value(kernel, "Midpoint(Circle(A, 1))"));
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Midpoint(Line(A, B))"));
    }

    @Test
    void distanceBetweenPointsLinesAndCircles() {
        assertScalar(5, value(kernel, "Distance(B, C)"));
        assertScalar(3, value(kernel, "Distance(C, Line(A, B))"));
        assertScalar(3, value(kernel, "Distance(Line(A, B), C)"));
        assertScalar(5, value(kernel, "Distance((7, 4), Segment(A, B))"));
        assertScalar(1, value(kernel, "Distance(C, Circle(A, 2))"));
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Distance(Line(A, B), Line(A, C))"));
    }

    @Test
    void intersectsLinesAndCircles() {
        assertPoint(0, 0, value(kernel, "Intersect(Line(A, B), Line(A, C))"));
        assertPoint(2, 0, value(kernel, "Intersect(Line(A, B), Line((2, -1), (2, 1)))"));
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Intersect(Line(A, B), Line(C, (1, 3)))"));
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Intersect(Segment(A, B), Segment((5, -1), (5, 1)))"));

        var both = assertInstanceOf(ListValue.class, value(kernel, "Intersect(Line(A, B), Circle(A, 2))"));
        assertEquals(2, both.size());
        assertPoint(-2, 0, both.items().get(0));
        assertPoint(2, 0, value(kernel, "Intersect(Circle(A, 2), Line(A, B), 2)"));
        assertPoint(2, 0, value(kernel, "Intersect(Ray(A, B), Circle(A, 2))"));
    }

    @Test
    void intersectionOfOtherObjectsStaysSymbolic() {
        var result = kernel.evaluate("Intersect(Circle(A, 1), Circle(B, 1))");
        ObjectValue symbolic = assertObject("Intersection", result.value());
        assertEquals("Circle", symbolic.property("obj1").orElseThrow().typeName());
    }

    @Test
    void polygonMeasuresAreaAndPerimeter() {
        ObjectValue triangle = assertObject("Polygon", value(kernel, "Polygon(A, B, C)"));
        assertScalar(6, triangle.property("area").orElseThrow());
        assertScalar(12, triangle.property("perimeter").orElseThrow());
        assertObject("Polygon", value(kernel, "Polygon([(0, 0), (1, 0), (1, 1), (0, 1)])"));
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Polygon(A, B)"));
    }

    @Test
    void vectorSlopeAndLength() {
        ObjectValue vector = assertObject("Vector", value(kernel, "Vector(B, C)"));
        assertPoint(-4, 3, vector.property("components").orElseThrow());
        assertScalar(5, value(kernel, "Length(Vector(B, C))"));
        assertScalar(-0.75, value(kernel, "Slope(Line(B, C))"));
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Slope(Line(A, C))"));

        assertScalar(5, value(kernel, "Length(Segment(B, C))"));
        assertScalar(12, value(kernel, "Length(Polygon(A, B, C))"));
        assertScalar(3, value(kernel, "Length([1, 2, 3])"));
        assertScalar(5, value(kernel, "Length((3, 4))"));
        assertScalar(5, value(kernel, "Length(\"hello\")"));
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Length(Line(A, B))"));
        assertThrows(InvalidArgumentException.class, () -> kernel.evaluate("Length(3)"));
    }
}
