package work.geodsl.construction;

import work.geodsl.value.DslValue;

/**
 * Re-evaluates a dependent's stored definition against the staged values of a redefinition.
 * Throwing aborts the whole redefinition.
 */
@FunctionalInterface
public interface Recomputation {
    DslValue recompute(ConstructionElement element, LabelResolver staged);
}
