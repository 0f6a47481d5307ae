package work.geodsl.value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntToDoubleFunction;
import java.util.stream.Collectors;
import work.geodsl.shared.Numbers;

/**
 * Coordinate tuple with two or three components; tuple literals such as {@code (1, 2)} evaluate
 * to points.
 */
public record PointValue(List<Double> coordinates) implements DslValue {
    public PointValue {
        if (coordinates == null || coordinates.size() < 2 || coordinates.size() > 3) {
            throw new IllegalArgumentException("A point needs two or three coordinates");
        }
        coordinates = List.copyOf(coordinates);
    }

    public static PointValue of(double x, double y) {
        return new PointValue(List.of(x, y));
    }

    public static PointValue of(double x, double y, double z) {
        return new PointValue(List.of(x, y, z));
    }

    public double x() {
        return coordinates.get(0);
    }

    public double y() {
        return coordinates.get(1);
    }

    public int dimension() {
        return coordinates.size();
    }

    public double coordinate(int index) {
        return index < coordinates.size() ? coordinates.get(index) : 0.0;
    }

    public PointValue map(IntToDoubleFunction component) {
        List<Double> next = new ArrayList<>(coordinates.size());
        for (int i = 0; i < coordinates.size(); i++) {
            next.add(component.applyAsDouble(i));
        }
        return new PointValue(next);
    }

    @Override
    public String typeName() {
        return "Point";
    }

    @Override
    public String display() {
        return coordinates.stream().map(Numbers::format).collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public Object toPlain() {
        Map<String, Object> plain = new LinkedHashMap<>();
        plain.put("type", typeName());
        plain.put("x", Numbers.plain(x()));
        plain.put("y", Numbers.plain(y()));
        if (dimension() == 3) {
            plain.put("z", Numbers.plain(coordinates.get(2)));
        }
        return plain;
    }
}
