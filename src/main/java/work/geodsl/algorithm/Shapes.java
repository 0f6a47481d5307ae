package work.geodsl.algorithm;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import work.geodsl.value.DslValue;
import work.geodsl.value.ListValue;
import work.geodsl.value.ObjectValue;
import work.geodsl.value.PointValue;
import work.geodsl.value.ScalarValue;

/**
 * Builders for the object values produced by geometry commands, and the point arithmetic they
 * share. Every builder derives its measured properties (length, slope, area) from the defining
 * points, so transformed objects stay consistent.
 */
final class Shapes {
    static final String LINE = "Line";
    static final String SEGMENT = "Segment";
    static final String RAY = "Ray";
    static final String VECTOR = "Vector";
    static final String CIRCLE = "Circle";
    static final String POLYGON = "Polygon";

    static final double EPSILON = 1e-9;

    private Shapes() {}

    static ObjectValue line(PointValue first, PointValue second) {
        var builder = ObjectValue.builder(LINE).put("point1", first).put("point2", second);
        slope(first, second).ifPresent(slope -> builder.put("slope", slope));
        return builder.build();
    }

    static ObjectValue segment(PointValue first, PointValue second) {
        return ObjectValue.builder(SEGMENT)
            .put("point1", first)
            .put("point2", second)
            .put("length", distance(first, second))
            .build();
    }

    static ObjectValue ray(PointValue start, PointValue through) {
        return ObjectValue.builder(RAY).put("point1", start).put("point2", through).build();
    }

    static ObjectValue vector(PointValue start, PointValue end) {
        PointValue components = minus(end, start);
        return ObjectValue.builder(VECTOR)
            .put("point1", start)
            .put("point2", end)
            .put("components", components)
            .put("length", norm(components))
            .build();
    }

    static ObjectValue circle(PointValue center, double radius) {
        return ObjectValue.builder(CIRCLE)
            .put("center", center)
            .put("radius", radius)
            .put("circumference", 2 * Math.PI * radius)
            .put("area", Math.PI * radius * radius)
            .build();
    }

    static ObjectValue polygon(List<PointValue> vertices) {
        double perimeter = 0;
        double doubledArea = 0;
        for (int i = 0; i < vertices.size(); i++) {
            PointValue current = vertices.get(i);
            PointValue next = vertices.get((i + 1) % vertices.size());
            perimeter += distance(current, next);
            doubledArea += current.x() * next.y() - next.x() * current.y();
        }
        return ObjectValue.builder(POLYGON)
            .put("vertices", new ListValue(new ArrayList<DslValue>(vertices)))
            .put("perimeter", perimeter)
            .put("area", Math.abs(doubledArea) / 2)
            .build();
    }

    /**
     * Line-like objects: lines, segments, rays and vectors, all defined by two points.
     */
    static boolean isLinear(DslValue value) {
        return value instanceof ObjectValue object
            && (object.is(LINE) || object.is(SEGMENT) || object.is(RAY) || object.is(VECTOR));
    }

    static PointValue first(ObjectValue linear) {
        return linear.pointProperty("point1").orElseThrow();
    }

    static PointValue second(ObjectValue linear) {
        return linear.pointProperty("point2").orElseThrow();
    }

    static PointValue direction(ObjectValue linear) {
        return minus(second(linear), first(linear));
    }

    static List<PointValue> vertices(ObjectValue polygon) {
        List<PointValue> vertices = new ArrayList<>();
        if (polygon.property("vertices").orElse(null) instanceof ListValue list) {
            for (DslValue item : list.items()) {
                if (item instanceof PointValue point) {
                    vertices.add(point);
                }
            }
        }
        return vertices;
    }

    static PointValue center(ObjectValue circle) {
        return circle.pointProperty("center").orElseThrow();
    }

    static double radius(ObjectValue circle) {
        return circle.property("radius")
            .filter(ScalarValue.class::isInstance)
            .map(value -> ((ScalarValue) value).value())
            .orElseThrow();
    }

    /**
     * Rebuilds {@code value} with every defining point mapped; circle radii are multiplied by
     * {@code lengthScale}. Empty for values that carry no geometry.
     */
    static Optional<DslValue> transform(DslValue value, UnaryOperator<PointValue> map, double lengthScale) {
        if (value instanceof PointValue point) {
            return Optional.of(map.apply(point));
        }
        if (!(value instanceof ObjectValue object)) {
            return Optional.empty();
        }
        return switch (object.type()) {
            case LINE -> Optional.of(line(map.apply(first(object)), map.apply(second(object))));
            case SEGMENT -> Optional.of(segment(map.apply(first(object)), map.apply(second(object))));
            case RAY -> Optional.of(ray(map.apply(first(object)), map.apply(second(object))));
            case VECTOR -> Optional.of(vector(map.apply(first(object)), map.apply(second(object))));
            case CIRCLE -> Optional.of(circle(map.apply(center(object)), Math.abs(radius(object) * lengthScale)));
            case POLYGON -> {
                List<PointValue> mapped = new ArrayList<>();
                for (PointValue vertex : vertices(object)) {
                    mapped.add(map.apply(vertex));
                }
                yield Optional.of(polygon(mapped));
            }
            default -> Optional.empty();
        };
    }

    static PointValue plus(PointValue a, PointValue b) {
        return a.map(i -> a.coordinate(i) + b.coordinate(i));
    }

    static PointValue minus(PointValue a, PointValue b) {
        return a.map(i -> a.coordinate(i) - b.coordinate(i));
    }

    static PointValue scale(PointValue a, double factor) {
        return a.map(i -> a.coordinate(i) * factor);
    }

    static double norm(PointValue a) {
        double sum = 0;
        for (int i = 0; i < a.dimension(); i++) {
            sum += a.coordinate(i) * a.coordinate(i);
        }
        return Math.sqrt(sum);
    }

    static double distance(PointValue a, PointValue b) {
        int dimension = Math.max(a.dimension(), b.dimension());
        double sum = 0;
        for (int i = 0; i < dimension; i++) {
            double delta = a.coordinate(i) - b.coordinate(i);
            sum += delta * delta;
        }
        return Math.sqrt(sum);
    }

    static boolean same(PointValue a, PointValue b) {
        return distance(a, b) < EPSILON;
    }

    static Optional<Double> slope(PointValue first, PointValue second) {
        double dx = second.x() - first.x();
        if (Math.abs(dx) < EPSILON) {
            return Optional.empty();
        }
        return Optional.of((second.y() - first.y()) / dx);
    }

    /**
     * Orthogonal projection of {@code point} on the infinite line through {@code linear}.
     */
    static PointValue project(PointValue point, ObjectValue linear) {
        PointValue origin = first(linear);
        PointValue direction = direction(linear);
        double length = direction.x() * direction.x() + direction.y() * direction.y();
        double t = ((point.x() - origin.x()) * direction.x() + (point.y() - origin.y()) * direction.y()) / length;
        return PointValue.of(origin.x() + t * direction.x(), origin.y() + t * direction.y());
    }
}
