package work.geodsl.parser;

/**
 * Node of a parsed input line: {@link Literal}, {@link Reference}, {@link CommandCall} or
 * {@link Assignment}.
 */
public interface ParsedExpression {
    /**
     * Canonical source text for this node; re-parsing it yields an equal tree.
     */
    String toSource();
}
