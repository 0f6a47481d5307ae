package work.geodsl.value;

/**
 * Result of evaluating an expression: a scalar, a coordinate tuple, a list, a text or a tagged
 * object description.
 */
public interface DslValue {
    String typeName();

    /**
     * Human readable form shown to the user.
     */
    String display();

    /**
     * Form that parses back to the same literal; differs from {@link #display()} only for text.
     */
    default String source() {
        return display();
    }

    /**
     * Maps, lists, numbers and strings only, ready for Jackson.
     */
    Object toPlain();
}
