package work.geodsl.value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public record ListValue(List<DslValue> items) implements DslValue {
    public ListValue {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static ListValue of(DslValue... items) {
        return new ListValue(List.of(items));
    }

    public int size() {
        return items.size();
    }

    @Override
    public String typeName() {
        return "List";
    }

    @Override
    public String display() {
        return items.stream().map(DslValue::display).collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public String source() {
        return items.stream().map(DslValue::source).collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public Object toPlain() {
        List<Object> plainItems = new ArrayList<>(items.size());
        for (DslValue item : items) {
            plainItems.add(item.toPlain());
        }
        Map<String, Object> plain = new LinkedHashMap<>();
        plain.put("type", typeName());
        plain.put("items", plainItems);
        return plain;
    }
}
