package work.geodsl.algorithm;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.geodsl.command.Command;
import work.geodsl.runtime.AlgorithmRegistry;
import work.geodsl.runtime.AlgorithmResult;
import work.geodsl.value.DslValue;
import work.geodsl.value.ListValue;
import work.geodsl.value.ObjectValue;
import work.geodsl.value.PointValue;
import work.geodsl.value.ScalarValue;
import work.geodsl.value.TextValue;

/**
 * Points, lines, circles and polygons in the plane, plus the measurements taken on them.
 */
public final class GeometryAlgorithms {
    private GeometryAlgorithms() {}

    public static AlgorithmRegistry register(AlgorithmRegistry registry) {
        registry.register(Command.POINT, GeometryAlgorithms::point);
        registry.register(Command.LINE, GeometryAlgorithms::line);
        registry.register(Command.SEGMENT, GeometryAlgorithms::segment);
        registry.register(Command.RAY, GeometryAlgorithms::ray);
        registry.register(Command.CIRCLE, GeometryAlgorithms::circle);
        registry.register(Command.MIDPOINT, GeometryAlgorithms::midpoint);
        registry.register(Command.DISTANCE, GeometryAlgorithms::distance);
        registry.register(Command.INTERSECT, GeometryAlgorithms::intersect);
        registry.register(Command.POLYGON, GeometryAlgorithms::polygon);
        registry.register(Command.VECTOR, GeometryAlgorithms::vector);
        registry.register(Command.SLOPE, GeometryAlgorithms::slope);
        registry.register(Command.LENGTH, GeometryAlgorithms::length);
        return registry;
    }

    private static AlgorithmResult point(Command command, List<DslValue> args, Set<String> dependencies) {
        if (args.size() == 2) {
            return AlgorithmResult.of(PointValue.of(
                Arguments.number(command, args, 0),
                Arguments.number(command, args, 1)
            ));
        }
        DslValue value = args.get(0);
        if (value instanceof PointValue point) {
            return AlgorithmResult.of(point);
        }
        if (value instanceof ListValue list && (list.size() == 2 || list.size() == 3)) {
            List<Double> coordinates = Arguments.numbers(command, args);
            return AlgorithmResult.of(new PointValue(coordinates));
        }
        throw Arguments.invalid(command, "cannot make a point from " + value.typeName());
    }

    private static AlgorithmResult line(Command command, List<DslValue> args, Set<String> dependencies) {
        PointValue start = Arguments.point(command, args, 0);
        DslValue second = args.get(1);
        if (second instanceof PointValue through) {
            if (Shapes.same(start, through)) {
                throw Arguments.invalid(command, "points coincide");
            }
            return AlgorithmResult.of(Shapes.line(start, through));
        }
        if (Shapes.isLinear(second)) {
            PointValue through = Shapes.plus(start, Shapes.direction((ObjectValue) second));
            return AlgorithmResult.of(Shapes.line(start, through), Map.of("parallelTo", second.typeName()));
        }
        throw Arguments.invalid(command, "argument 2 must be a point or a line, got " + second.typeName());
    }

    private static AlgorithmResult segment(Command command, List<DslValue> args, Set<String> dependencies) {
        return AlgorithmResult.of(Shapes.segment(Arguments.point(command, args, 0), Arguments.point(command, args, 1)));
    }

    private static AlgorithmResult ray(Command command, List<DslValue> args, Set<String> dependencies) {
        PointValue start = Arguments.point(command, args, 0);
        DslValue second = args.get(1);
        PointValue through;
        if (second instanceof PointValue point) {
            through = point;
        } else if (Shapes.isLinear(second)) {
            through = Shapes.plus(start, Shapes.direction((ObjectValue) second));
        } else {
            throw Arguments.invalid(command, "argument 2 must be a point or a vector, got " + second.typeName());
        }
        if (Shapes.same(start, through)) {
            throw Arguments.invalid(command, "ray has no direction");
        }
        return AlgorithmResult.of(Shapes.ray(start, through));
    }

    private static AlgorithmResult circle(Command command, List<DslValue> args, Set<String> dependencies) {
        PointValue first = Arguments.point(command, args, 0);
        if (args.size() == 3) {
            return AlgorithmResult.of(circumcircle(
                command,
                first,
                Arguments.point(command, args, 1),
                Arguments.point(command, args, 2)
            ));
        }
        DslValue second = args.get(1);
        if (second instanceof ScalarValue radius) {
            if (radius.value() < 0) {
                throw Arguments.invalid(command, "radius must not be negative");
            }
            return AlgorithmResult.of(Shapes.circle(first, radius.value()));
        }
        if (second instanceof PointValue through) {
            return AlgorithmResult.of(Shapes.circle(first, Shapes.distance(first, through)));
        }
        throw Arguments.invalid(command, "argument 2 must be a radius or a point, got " + second.typeName());
    }

    private static ObjectValue circumcircle(Command command, PointValue a, PointValue b, PointValue c) {
        double d = 2 * (a.x() * (b.y() - c.y()) + b.x() * (c.y() - a.y()) + c.x() * (a.y() - b.y()));
        if (Math.abs(d) < Shapes.EPSILON) {
            throw Arguments.invalid(command, "points are collinear");
        }
        double a2 = a.x() * a.x() + a.y() * a.y();
        double b2 = b.x() * b.x() + b.y() * b.y();
        double c2 = c.x() * c.x() + c.y() * c.y();
        double x = (a2 * (b.y() - c.y()) + b2 * (c.y() - a.y()) + c2 * (a.y() - b.y())) / d;
        double y = (a2 * (c.x() - b.x()) + b2 * (a.x() - c.x()) + c2 * (b.x() - a.x())) / d;
        PointValue center = PointValue.of(x, y);
        return Shapes.circle(center, Shapes.distance(center, a));
    }

    private static AlgorithmResult midpoint(Command command, List<DslValue> args, Set<String> dependencies) {
        if (args.size() == 2) {
            PointValue a = Arguments.point(command, args, 0);
            PointValue b = Arguments.point(command, args, 1);
            return AlgorithmResult.of(Shapes.scale(Shapes.plus(a, b), 0.5));
        }
        DslValue value = args.get(0);
        if (value instanceof ObjectValue object) {
            if (Shapes.isLinear(object) && !object.is(Shapes.LINE) && !object.is(Shapes.RAY)) {
                return AlgorithmResult.of(Shapes.scale(Shapes.plus(Shapes.first(object), Shapes.second(object)), 0.5));
            }
            if (object.is(Shapes.CIRCLE)) {
                return AlgorithmResult.of(Shapes.center(object));
            }
            if (object.is(Shapes.POLYGON)) {
                List<PointValue> vertices = Shapes.vertices(object);
                PointValue sum = vertices.get(0);
                for (int i = 1; i < vertices.size(); i++) {
                    sum = Shapes.plus(sum, vertices.get(i));
                }
                return AlgorithmResult.of(Shapes.scale(sum, 1.0 / vertices.size()));
            }
        }
        throw Arguments.invalid(command, "no midpoint for " + value.typeName());
    }

    private static AlgorithmResult distance(Command command, List<DslValue> args, Set<String> dependencies) {
        DslValue a = args.get(0);
        DslValue b = args.get(1);
        if (b instanceof PointValue && !(a instanceof PointValue)) {
            DslValue swap = a;
            a = b;
            b = swap;
        }
        if (a instanceof PointValue point) {
            if (b instanceof PointValue other) {
                return AlgorithmResult.of(ScalarValue.of(Shapes.distance(point, other)));
            }
            if (Shapes.isLinear(b)) {
                PointValue closest = closestPoint(point, (ObjectValue) b);
                return AlgorithmResult.of(ScalarValue.of(Shapes.distance(point, closest)));
            }
            if (isCircle(b)) {
                ObjectValue circle = (ObjectValue) b;
                double fromCenter = Shapes.distance(point, Shapes.center(circle));
                return AlgorithmResult.of(ScalarValue.of(Math.abs(fromCenter - Shapes.radius(circle))));
            }
        }
        throw Arguments.invalid(command, "cannot measure between " + a.typeName() + " and " + b.typeName());
    }

    private static PointValue closestPoint(PointValue point, ObjectValue linear) {
        PointValue origin = Shapes.first(linear);
        PointValue direction = Shapes.direction(linear);
        double length = direction.x() * direction.x() + direction.y() * direction.y();
        double t = ((point.x() - origin.x()) * direction.x() + (point.y() - origin.y()) * direction.y()) / length;
        t = clamp(linear, t);
        return PointValue.of(origin.x() + t * direction.x(), origin.y() + t * direction.y());
    }

    private static double clamp(ObjectValue linear, double t) {
        if (linear.is(Shapes.LINE)) {
            return t;
        }
        if (linear.is(Shapes.RAY)) {
            return Math.max(0, t);
        }
        return Math.min(1, Math.max(0, t));
    }

    private static boolean onObject(ObjectValue linear, double t) {
        return Math.abs(clamp(linear, t) - t) < Shapes.EPSILON;
    }

    private static AlgorithmResult intersect(Command command, List<DslValue> args, Set<String> dependencies) {
        DslValue a = args.get(0);
        DslValue b = args.get(1);
        if (isCircle(a) && Shapes.isLinear(b)) {
            DslValue swap = a;
            a = b;
            b = swap;
        }
        List<PointValue> points;
        if (Shapes.isLinear(a) && Shapes.isLinear(b)) {
            points = lineLine(command, (ObjectValue) a, (ObjectValue) b);
        } else if (Shapes.isLinear(a) && isCircle(b)) {
            points = lineCircle((ObjectValue) a, (ObjectValue) b);
        } else {
            if (args.size() == 3) {
                throw Arguments.invalid(command, "cannot select an intersection of " + a.typeName() + " and " + b.typeName());
            }
            ObjectValue symbolic = ObjectValue.builder("Intersection").put("obj1", a).put("obj2", b).build();
            return new AlgorithmResult(symbolic, Map.of("symbolic", true));
        }

        if (points.isEmpty()) {
            throw Arguments.invalid(command, "objects do not intersect");
        }
        if (args.size() == 3) {
            long index = Arguments.integer(command, args, 2);
            if (index < 1 || index > points.size()) {
                throw Arguments.invalid(command, "no intersection point " + index);
            }
            return AlgorithmResult.of(points.get((int) index - 1));
        }
        if (points.size() == 1) {
            return AlgorithmResult.of(points.get(0));
        }
        return AlgorithmResult.of(new ListValue(new ArrayList<DslValue>(points)));
    }

    private static List<PointValue> lineLine(Command command, ObjectValue first, ObjectValue second) {
        PointValue p = Shapes.first(first);
        PointValue r = Shapes.direction(first);
        PointValue q = Shapes.first(second);
        PointValue s = Shapes.direction(second);
        double cross = r.x() * s.y() - r.y() * s.x();
        if (Math.abs(cross) < Shapes.EPSILON) {
            throw Arguments.invalid(command, "lines are parallel");
        }
        double qpx = q.x() - p.x();
        double qpy = q.y() - p.y();
        double t = (qpx * s.y() - qpy * s.x()) / cross;
        double u = (qpx * r.y() - qpy * r.x()) / cross;
        if (!onObject(first, t) || !onObject(second, u)) {
            return List.of();
        }
        return List.of(PointValue.of(p.x() + t * r.x(), p.y() + t * r.y()));
    }

    private static List<PointValue> lineCircle(ObjectValue linear, ObjectValue circle) {
        PointValue p = Shapes.first(linear);
        PointValue d = Shapes.direction(linear);
        PointValue center = Shapes.center(circle);
        double radius = Shapes.radius(circle);
        double fx = p.x() - center.x();
        double fy = p.y() - center.y();
        double a = d.x() * d.x() + d.y() * d.y();
        double b = 2 * (fx * d.x() + fy * d.y());
        double c = fx * fx + fy * fy - radius * radius;
        double discriminant = b * b - 4 * a * c;
        if (discriminant < -Shapes.EPSILON) {
            return List.of();
        }
        double root = Math.sqrt(Math.max(0, discriminant));
        List<Double> parameters = root < Shapes.EPSILON
            ? List.of(-b / (2 * a))
            : List.of((-b - root) / (2 * a), (-b + root) / (2 * a));
        List<PointValue> points = new ArrayList<>();
        for (double t : parameters) {
            if (onObject(linear, t)) {
                points.add(PointValue.of(p.x() + t * d.x(), p.y() + t * d.y()));
            }
        }
        return points;
    }

    private static boolean isCircle(DslValue value) {
        return value instanceof ObjectValue object && object.is(Shapes.CIRCLE);
    }

    private static AlgorithmResult polygon(Command command, List<DslValue> args, Set<String> dependencies) {
        List<PointValue> vertices = Arguments.points(command, args);
        if (vertices.size() < 3) {
            throw Arguments.invalid(command, "needs at least three vertices");
        }
        return AlgorithmResult.of(Shapes.polygon(vertices));
    }

    private static AlgorithmResult vector(Command command, List<DslValue> args, Set<String> dependencies) {
        PointValue first = Arguments.point(command, args, 0);
        if (args.size() == 1) {
            return AlgorithmResult.of(Shapes.vector(first.map(i -> 0.0), first));
        }
        return AlgorithmResult.of(Shapes.vector(first, Arguments.point(command, args, 1)));
    }

    private static AlgorithmResult slope(Command command, List<DslValue> args, Set<String> dependencies) {
        DslValue value = args.get(0);
        if (!Shapes.isLinear(value)) {
            throw Arguments.invalid(command, "argument 1 must be a line, got " + value.typeName());
        }
        ObjectValue linear = (ObjectValue) value;
        double slope = Shapes.slope(Shapes.first(linear), Shapes.second(linear))
            .orElseThrow(() -> Arguments.invalid(command, "vertical line has no slope"));
        return AlgorithmResult.of(ScalarValue.of(slope));
    }

    private static AlgorithmResult length(Command command, List<DslValue> args, Set<String> dependencies) {
        DslValue value = args.get(0);
        if (value instanceof PointValue point) {
            return AlgorithmResult.of(ScalarValue.of(Shapes.norm(point)));
        }
        if (value instanceof ListValue list) {
            return AlgorithmResult.of(ScalarValue.of(list.size()));
        }
        if (value instanceof TextValue text) {
            return AlgorithmResult.of(ScalarValue.of(text.text().length()));
        }
        if (value instanceof ObjectValue object) {
            String measure = switch (object.type()) {
                case Shapes.SEGMENT, Shapes.VECTOR -> "length";
                case Shapes.POLYGON -> "perimeter";
                case Shapes.CIRCLE -> "circumference";
                default -> null;
            };
            if (measure != null && object.property(measure).orElse(null) instanceof ScalarValue scalar) {
                return AlgorithmResult.of(scalar);
            }
        }
        throw Arguments.invalid(command, value.typeName() + " has no finite length");
    }
}
