package work.geodsl.value;

import java.util.Objects;

public record TextValue(String text) implements DslValue {
    public TextValue {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String typeName() {
        return "Text";
    }

    @Override
    public String display() {
        return text;
    }

    /**
     * Quoted literal with backslashes and quotes escaped, readable by the lexer.
     */
    @Override
    public String source() {
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    @Override
    public Object toPlain() {
        return text;
    }
}
