package work.geodsl.construction;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.geodsl.error.CircularDefinitionException;
import work.geodsl.error.UndefinedLabelException;
import work.geodsl.parser.ParsedExpression;
import work.geodsl.value.DslValue;

/**
 * Labeled elements and their dependency graph. The graph stays acyclic, and a redefinition either
 * commits the new value together with every recomputed dependent or leaves the graph untouched.
 * Not thread-safe: one evaluator owns a construction at a time.
 */
public final class Construction implements LabelResolver {
    private static final Logger LOG = LoggerFactory.getLogger(Construction.class);

    private final Map<String, ConstructionElement> elements = new LinkedHashMap<>();

    public boolean contains(String label) {
        return label != null && elements.containsKey(label);
    }

    public Optional<ConstructionElement> element(String label) {
        return Optional.ofNullable(label == null ? null : elements.get(label));
    }

    @Override
    public Optional<DslValue> resolve(String label) {
        return element(label).map(ConstructionElement::value);
    }

    /**
     * Labels in definition order.
     */
    public Set<String> labels() {
        return Collections.unmodifiableSet(elements.keySet());
    }

    public Collection<ConstructionElement> elements() {
        return Collections.unmodifiableCollection(elements.values());
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public Set<String> dependentsOf(String label) {
        return element(label).map(ConstructionElement::dependents).orElse(Set.of());
    }

    /**
     * Binds a fresh label.
     *
     * @throws IllegalStateException when the label is already bound; rebinding goes through
     *     {@link #redefine}
     */
    public ConstructionElement define(String label, ParsedExpression definition, DslValue value, Set<String> dependencies) {
        Objects.requireNonNull(label, "label");
        if (elements.containsKey(label)) {
            throw new IllegalStateException("Label already defined: " + label);
        }
        Set<String> edges = normalize(dependencies);
        if (edges.contains(label)) {
            throw new CircularDefinitionException(label);
        }
        requireBound(edges);

        var element = new ConstructionElement(label, definition, value, edges);
        elements.put(label, element);
        for (String dependency : edges) {
            elements.get(dependency).addDependent(label);
        }
        return element;
    }

    /**
     * Replaces the definition of a bound label and recomputes every transitive dependent in
     * topological order. Nothing is written until every recomputation has succeeded.
     *
     * @return the recomputed dependents, in the order they were recomputed
     * @throws CircularDefinitionException when a new dependency reaches back to {@code label}
     */
    public List<String> redefine(
        String label,
        ParsedExpression definition,
        DslValue value,
        Set<String> dependencies,
        Recomputation recomputation
    ) {
        ConstructionElement target = element(label).orElseThrow(() -> new UndefinedLabelException(label));
        Set<String> edges = normalize(dependencies);
        requireBound(edges);
        if (reachesBack(label, edges)) {
            throw new CircularDefinitionException(label);
        }

        List<String> order = transitiveDependents(label);
        Map<String, DslValue> staged = new HashMap<>();
        staged.put(label, Objects.requireNonNull(value, "value"));
        LabelResolver view = candidate -> staged.containsKey(candidate)
            ? Optional.of(staged.get(candidate))
            : resolve(candidate);
        for (String dependent : order) {
            DslValue next = recomputation.recompute(elements.get(dependent), view);
            staged.put(dependent, Objects.requireNonNull(next, "recomputed value for " + dependent));
        }

        Set<String> previous = target.dependencies();
        for (String removed : previous) {
            if (!edges.contains(removed)) {
                elements.get(removed).removeDependent(label);
            }
        }
        for (String added : edges) {
            if (!previous.contains(added)) {
                elements.get(added).addDependent(label);
            }
        }
        target.replaceDefinition(definition, edges);
        for (var entry : staged.entrySet()) {
            elements.get(entry.getKey()).updateValue(entry.getValue());
        }
        LOG.debug("Redefined {} ({} dependents recomputed)", label, order.size());
        return order;
    }

    /**
     * Every element that depends on {@code label} directly or transitively, ordered so that each
     * one comes after all of its own dependencies.
     */
    public List<String> transitiveDependents(String label) {
        Set<String> affected = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>(dependentsOf(label));
        while (!pending.isEmpty()) {
            String current = pending.poll();
            if (!current.equals(label) && affected.add(current)) {
                pending.addAll(dependentsOf(current));
            }
        }

        Map<String, Integer> unsettled = new HashMap<>();
        for (String candidate : affected) {
            int count = 0;
            for (String dependency : elements.get(candidate).dependencies()) {
                if (affected.contains(dependency)) {
                    count++;
                }
            }
            unsettled.put(candidate, count);
        }

        Deque<String> ready = new ArrayDeque<>();
        for (String candidate : elements.keySet()) {
            if (affected.contains(candidate) && unsettled.get(candidate) == 0) {
                ready.add(candidate);
            }
        }
        List<String> order = new ArrayList<>(affected.size());
        while (!ready.isEmpty()) {
            String current = ready.poll();
            order.add(current);
            for (String dependent : dependentsOf(current)) {
                Integer remaining = unsettled.get(dependent);
                if (remaining == null) {
                    continue;
                }
                unsettled.put(dependent, remaining - 1);
                if (remaining - 1 == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (order.size() != affected.size()) {
            throw new IllegalStateException("Dependency graph below " + label + " is not acyclic");
        }
        return order;
    }

    /**
     * Session teardown.
     */
    public void clear() {
        elements.clear();
    }

    private boolean reachesBack(String label, Set<String> start) {
        Deque<String> pending = new ArrayDeque<>(start);
        Set<String> visited = new HashSet<>();
        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (current.equals(label)) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            ConstructionElement element = elements.get(current);
            if (element != null) {
                pending.addAll(element.dependencies());
            }
        }
        return false;
    }

    private void requireBound(Set<String> labels) {
        for (String dependency : labels) {
            if (!elements.containsKey(dependency)) {
                throw new UndefinedLabelException(dependency);
            }
        }
    }

    private static Set<String> normalize(Set<String> dependencies) {
        return dependencies == null ? Set.of() : new LinkedHashSet<>(dependencies);
    }
}
