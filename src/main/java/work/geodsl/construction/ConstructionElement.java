package work.geodsl.construction;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import work.geodsl.parser.ParsedExpression;
import work.geodsl.value.DslValue;

/**
 * Named node of the construction. Forward edges ({@link #dependencies()}) are authoritative;
 * {@link #dependents()} is maintained by {@link Construction} as their reverse.
 */
public final class ConstructionElement {
    private final String label;
    private ParsedExpression definition;
    private DslValue value;
    private Set<String> dependencies;
    private final Set<String> dependents = new LinkedHashSet<>();

    ConstructionElement(String label, ParsedExpression definition, DslValue value, Set<String> dependencies) {
        this.label = Objects.requireNonNull(label, "label");
        this.definition = Objects.requireNonNull(definition, "definition");
        this.value = Objects.requireNonNull(value, "value");
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
    }

    public String label() {
        return label;
    }

    /**
     * Expression the value was computed from; re-evaluated when an input is redefined.
     */
    public ParsedExpression definition() {
        return definition;
    }

    public String definitionText() {
        return definition.toSource();
    }

    public DslValue value() {
        return value;
    }

    public Set<String> dependencies() {
        return dependencies;
    }

    public Set<String> dependents() {
        return Collections.unmodifiableSet(dependents);
    }

    public boolean isIndependent() {
        return dependencies.isEmpty();
    }

    void replaceDefinition(ParsedExpression newDefinition, Set<String> newDependencies) {
        this.definition = newDefinition;
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(newDependencies));
    }

    void updateValue(DslValue newValue) {
        this.value = newValue;
    }

    void addDependent(String dependent) {
        dependents.add(dependent);
    }

    void removeDependent(String dependent) {
        dependents.remove(dependent);
    }

    @Override
    public String toString() {
        return label + " = " + definitionText() + " -> " + value.display();
    }
}
