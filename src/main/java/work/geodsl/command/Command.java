package work.geodsl.command;

import static work.geodsl.command.ArgShape.ANY;
import static work.geodsl.command.ArgShape.GEOMETRIC;
import static work.geodsl.command.ArgShape.LIST;
import static work.geodsl.command.ArgShape.SCALAR;

import java.util.List;

/**
 * Every command known to the kernel. The constant names are internal identifiers only: users
 * address a command by its {@link #displayName()}, which is the sole key of {@link CommandTable}.
 */
public enum Command {
    MOD(CommandCategory.ALGEBRA, "Mod", 2, 2, SCALAR, SCALAR),
    DIV(CommandCategory.ALGEBRA, "Div", 2, 2, SCALAR, SCALAR),
    MIN(CommandCategory.ALGEBRA, "Min", 1, Command.VARIADIC, ANY),
    MAX(CommandCategory.ALGEBRA, "Max", 1, Command.VARIADIC, ANY),
    LCM(CommandCategory.ALGEBRA, "LCM", 1, Command.VARIADIC, ANY),
    GCD(CommandCategory.ALGEBRA, "GCD", 1, Command.VARIADIC, ANY),
    EXPAND(CommandCategory.ALGEBRA, "Expand", 1, 1, ANY),
    FACTOR(CommandCategory.ALGEBRA, "Factor", 1, 1, ANY),
    SIMPLIFY(CommandCategory.ALGEBRA, "Simplify", 1, 1, ANY),

    LINE(CommandCategory.GEOMETRY, "Line", 2, 2, ArgShape.POINT, GEOMETRIC),
    RAY(CommandCategory.GEOMETRY, "Ray", 2, 2, ArgShape.POINT, GEOMETRIC),
    ANGULAR_BISECTOR(CommandCategory.GEOMETRY, "AngularBisector", 2, 3, GEOMETRIC),
    ORTHOGONAL_LINE(CommandCategory.GEOMETRY, "OrthogonalLine", 2, 2, ArgShape.POINT, GEOMETRIC),
    TANGENT(CommandCategory.GEOMETRY, "Tangent", 2, 2, ANY, GEOMETRIC),
    SEGMENT(CommandCategory.GEOMETRY, "Segment", 2, 2, ArgShape.POINT, ArgShape.POINT),
    SLOPE(CommandCategory.GEOMETRY, "Slope", 1, 1, GEOMETRIC),
    ANGLE(CommandCategory.GEOMETRY, "Angle", 1, 3, GEOMETRIC),
    POINT(CommandCategory.GEOMETRY, "Point", 1, 2, ANY),
    MIDPOINT(CommandCategory.GEOMETRY, "Midpoint", 1, 2, GEOMETRIC),
    LINE_BISECTOR(CommandCategory.GEOMETRY, "LineBisector", 1, 2, GEOMETRIC),
    INTERSECT(CommandCategory.GEOMETRY, "Intersect", 2, 3, GEOMETRIC, GEOMETRIC, SCALAR),
    DISTANCE(CommandCategory.GEOMETRY, "Distance", 2, 2, GEOMETRIC, GEOMETRIC),
    LENGTH(CommandCategory.GEOMETRY, "Length", 1, 1, ANY),
    RADIUS(CommandCategory.GEOMETRY, "Radius", 1, 1, GEOMETRIC),
    CIRCLE_ARC(CommandCategory.GEOMETRY, "CircleArc", 3, 3, ArgShape.POINT),
    ARC(CommandCategory.GEOMETRY, "Arc", 3, 3, GEOMETRIC, ANY),
    SECTOR(CommandCategory.GEOMETRY, "Sector", 3, 3, GEOMETRIC, ANY),
    POLYGON(CommandCategory.GEOMETRY, "Polygon", 1, Command.VARIADIC, ANY),
    AREA(CommandCategory.GEOMETRY, "Area", 1, Command.VARIADIC, ANY),
    CIRCUMFERENCE(CommandCategory.GEOMETRY, "Circumference", 1, 1, GEOMETRIC),
    PERIMETER(CommandCategory.GEOMETRY, "Perimeter", 1, 1, GEOMETRIC),
    LOCUS(CommandCategory.GEOMETRY, "Locus", 2, 2, ArgShape.POINT, ArgShape.POINT),
    CENTROID(CommandCategory.GEOMETRY, "Centroid", 1, 1, GEOMETRIC),

    SUM(CommandCategory.STATISTICS, "Sum", 1, Command.VARIADIC, ANY),
    MEAN(CommandCategory.STATISTICS, "Mean", 1, Command.VARIADIC, ANY),
    VARIANCE(CommandCategory.STATISTICS, "Variance", 1, Command.VARIADIC, ANY),
    SD(CommandCategory.STATISTICS, "SD", 1, Command.VARIADIC, ANY),
    MEDIAN(CommandCategory.STATISTICS, "Median", 1, Command.VARIADIC, ANY),
    MODE(CommandCategory.STATISTICS, "Mode", 1, Command.VARIADIC, ANY),

    RANDOM(CommandCategory.PROBABILITY, "Random", 0, 2, SCALAR),
    RANDOM_NORMAL(CommandCategory.PROBABILITY, "RandomNormal", 2, 2, SCALAR),
    NORMAL(CommandCategory.PROBABILITY, "Normal", 2, 4, ANY),
    BINOMIAL(CommandCategory.PROBABILITY, "Binomial", 2, 4, ANY),

    ROOT(CommandCategory.FUNCTION, "Root", 1, 3, ANY),
    ROOTS(CommandCategory.FUNCTION, "Roots", 3, 3, ANY),
    POLYNOMIAL(CommandCategory.FUNCTION, "Polynomial", 1, 1, ANY),
    FUNCTION(CommandCategory.FUNCTION, "Function", 1, 3, ANY),
    EXTREMUM(CommandCategory.FUNCTION, "Extremum", 1, 3, ANY),
    DERIVATIVE(CommandCategory.FUNCTION, "Derivative", 1, 3, ANY),
    INTEGRAL(CommandCategory.FUNCTION, "Integral", 1, 4, ANY),
    LIMIT(CommandCategory.FUNCTION, "Limit", 2, 2, ANY),

    ELLIPSE(CommandCategory.CONIC, "Ellipse", 3, 3, ArgShape.POINT, ArgShape.POINT, ANY),
    HYPERBOLA(CommandCategory.CONIC, "Hyperbola", 3, 3, ArgShape.POINT, ArgShape.POINT, ANY),
    CONIC(CommandCategory.CONIC, "Conic", 5, 6, ANY),
    CIRCLE(CommandCategory.CONIC, "Circle", 2, 3, ArgShape.POINT, ANY),
    PARABOLA(CommandCategory.CONIC, "Parabola", 2, 2, ArgShape.POINT, GEOMETRIC),
    FOCUS(CommandCategory.CONIC, "Focus", 1, 1, GEOMETRIC),
    CENTER(CommandCategory.CONIC, "Center", 1, 1, GEOMETRIC),

    SORT(CommandCategory.LIST, "Sort", 1, 2, LIST, ANY),
    FIRST(CommandCategory.LIST, "First", 1, 2, LIST, SCALAR),
    LAST(CommandCategory.LIST, "Last", 1, 2, LIST, SCALAR),
    TAKE(CommandCategory.LIST, "Take", 3, 3, LIST, SCALAR),
    ELEMENT(CommandCategory.LIST, "Element", 2, Command.VARIADIC, LIST, SCALAR),
    APPEND(CommandCategory.LIST, "Append", 2, 2, ANY),
    JOIN(CommandCategory.LIST, "Join", 1, Command.VARIADIC, LIST),
    SEQUENCE(CommandCategory.LIST, "Sequence", 1, 5, ANY),

    VECTOR(CommandCategory.VECTOR, "Vector", 1, 2, ArgShape.POINT),
    UNIT_VECTOR(CommandCategory.VECTOR, "UnitVector", 1, 1, GEOMETRIC),
    INVERT(CommandCategory.VECTOR, "Invert", 1, 1, ANY),
    TRANSPOSE(CommandCategory.VECTOR, "Transpose", 1, 1, LIST),
    DETERMINANT(CommandCategory.VECTOR, "Determinant", 1, 1, LIST),

    MIRROR(CommandCategory.TRANSFORMATION, "Mirror", 2, 2, GEOMETRIC, GEOMETRIC),
    DILATE(CommandCategory.TRANSFORMATION, "Dilate", 2, 3, GEOMETRIC, SCALAR, ArgShape.POINT),
    ROTATE(CommandCategory.TRANSFORMATION, "Rotate", 2, 3, GEOMETRIC, SCALAR, ArgShape.POINT),
    TRANSLATE(CommandCategory.TRANSFORMATION, "Translate", 2, 2, GEOMETRIC, GEOMETRIC),

    TEXT(CommandCategory.TEXT, "Text", 1, 4, ANY),

    IF(CommandCategory.LOGICAL, "If", 2, 3, ANY),
    COUNT_IF(CommandCategory.LOGICAL, "CountIf", 2, 2, ANY),
    DEFINED(CommandCategory.LOGICAL, "Defined", 1, 1, ANY),

    SET_COLOR(CommandCategory.SCRIPTING, "SetColor", 2, 4, ANY),
    SET_LINE_THICKNESS(CommandCategory.SCRIPTING, "SetLineThickness", 2, 2, GEOMETRIC, SCALAR),
    SET_POINT_SIZE(CommandCategory.SCRIPTING, "SetPointSize", 2, 2, GEOMETRIC, SCALAR),
    DELETE(CommandCategory.SCRIPTING, "Delete", 1, 1, ANY),

    SOLVE(CommandCategory.CAS, "Solve", 1, 2, ANY),
    SUBSTITUTE(CommandCategory.CAS, "Substitute", 2, 3, ANY);

    /** Upper bound marker for commands taking any number of arguments. */
    public static final int VARIADIC = Integer.MAX_VALUE;

    private final CommandCategory category;
    private final String displayName;
    private final int minArgs;
    private final int maxArgs;
    private final List<ArgShape> shapes;

    Command(CommandCategory category, String displayName, int minArgs, int maxArgs, ArgShape... shapes) {
        this.category = category;
        this.displayName = displayName;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.shapes = List.of(shapes);
    }

    public CommandCategory category() {
        return category;
    }

    public String displayName() {
        return displayName;
    }

    public int minArgs() {
        return minArgs;
    }

    public int maxArgs() {
        return maxArgs;
    }

    public boolean isVariadic() {
        return maxArgs == VARIADIC;
    }

    public boolean acceptsCount(int count) {
        return count >= minArgs && count <= maxArgs;
    }

    /**
     * Shape expected at {@code index}; positions past the declared shapes repeat the last one.
     */
    public ArgShape shapeAt(int index) {
        if (shapes.isEmpty()) {
            return ArgShape.ANY;
        }
        return shapes.get(Math.min(index, shapes.size() - 1));
    }

    public String arityDescription() {
        if (minArgs == maxArgs) {
            return Integer.toString(minArgs);
        }
        if (isVariadic()) {
            return "at least " + minArgs;
        }
        return minArgs + ".." + maxArgs;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
