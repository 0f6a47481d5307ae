package work.geodsl.algorithm;

import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import work.geodsl.command.Command;
import work.geodsl.runtime.AlgorithmRegistry;
import work.geodsl.runtime.AlgorithmResult;
import work.geodsl.value.DslValue;
import work.geodsl.value.ObjectValue;
import work.geodsl.value.PointValue;

/**
 * Rigid motions and dilations applied to points and the shapes built from them.
 */
public final class TransformationAlgorithms {
    private TransformationAlgorithms() {}

    public static AlgorithmRegistry register(AlgorithmRegistry registry) {
        registry.register(Command.TRANSLATE, TransformationAlgorithms::translate);
        registry.register(Command.DILATE, TransformationAlgorithms::dilate);
        registry.register(Command.MIRROR, TransformationAlgorithms::mirror);
        return registry;
    }

    private static AlgorithmResult translate(Command command, List<DslValue> args, Set<String> dependencies) {
        DslValue by = args.get(1);
        PointValue offset;
        if (by instanceof PointValue point) {
            offset = point;
        } else if (by instanceof ObjectValue vector && vector.is(Shapes.VECTOR)) {
            offset = Shapes.direction(vector);
        } else {
            throw Arguments.invalid(command, "argument 2 must be a vector, got " + by.typeName());
        }
        return apply(command, args.get(0), point -> Shapes.plus(point, offset), 1);
    }

    private static AlgorithmResult dilate(Command command, List<DslValue> args, Set<String> dependencies) {
        double factor = Arguments.number(command, args, 1);
        PointValue center = args.size() == 3 ? Arguments.point(command, args, 2) : PointValue.of(0, 0);
        UnaryOperator<PointValue> map =
            point -> point.map(i -> center.coordinate(i) + factor * (point.coordinate(i) - center.coordinate(i)));
        return apply(command, args.get(0), map, factor);
    }

    private static AlgorithmResult mirror(Command command, List<DslValue> args, Set<String> dependencies) {
        DslValue mirror = args.get(1);
        if (mirror instanceof PointValue center) {
            return apply(command, args.get(0), point -> Shapes.minus(Shapes.scale(center, 2), point), 1);
        }
        if (Shapes.isLinear(mirror)) {
            ObjectValue axis = (ObjectValue) mirror;
            return apply(command, args.get(0), point -> {
                PointValue foot = Shapes.project(point, axis);
                return PointValue.of(2 * foot.x() - point.x(), 2 * foot.y() - point.y());
            }, 1);
        }
        throw Arguments.invalid(command, "cannot mirror at " + mirror.typeName());
    }

    private static AlgorithmResult apply(Command command, DslValue value, UnaryOperator<PointValue> map, double scale) {
        DslValue image = Shapes.transform(value, map, scale)
            .orElseThrow(() -> Arguments.invalid(command, "cannot transform " + value.typeName()));
        return AlgorithmResult.of(image);
    }
}
