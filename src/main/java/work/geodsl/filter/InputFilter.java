package work.geodsl.filter;

import work.geodsl.parser.ParsedExpression;

/**
 * Predicate over a whole parsed line, consulted before anything is evaluated.
 */
@FunctionalInterface
public interface InputFilter {
    boolean accepts(ParsedExpression expression);
}
