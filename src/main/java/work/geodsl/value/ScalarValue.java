package work.geodsl.value;

import work.geodsl.shared.Numbers;

public record ScalarValue(double value) implements DslValue {
    public static ScalarValue of(double value) {
        return new ScalarValue(value);
    }

    @Override
    public String typeName() {
        return "Number";
    }

    @Override
    public String display() {
        return Numbers.format(value);
    }

    @Override
    public Object toPlain() {
        return Numbers.plain(value);
    }
}
