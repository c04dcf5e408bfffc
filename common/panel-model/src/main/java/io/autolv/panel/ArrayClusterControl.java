package io.autolv.panel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Array of clusters sharing one element layout.
 * <p>
 * The value cannot be assigned directly: the session layer builds element clusters with
 * {@link #newElement()} and installs them with {@link #replaceElements(List)}.
 */
public final class ArrayClusterControl extends Control<List<ClusterControl>> {

    private final Supplier<ClusterControl> elementFactory;
    private final List<String> layout;
    private final Set<String> members;
    private List<ClusterControl> elements = List.of();

    public ArrayClusterControl(ControlAttributes attributes, Supplier<ClusterControl> elementFactory) {
        super(ControlKind.ARRAY_CLUSTER, attributes);
        this.elementFactory = Objects.requireNonNull(elementFactory, "elementFactory");
        this.layout = newElement().names();
        this.members = Set.copyOf(layout);
    }

    @Override
    public List<ClusterControl> value() {
        return elements;
    }

    /**
     * Always fails: array-of-cluster values only arrive through {@link #replaceElements(List)}.
     */
    @Override
    public void setValue(Object value) {
        throw ControlTypeException.rejected(this, value, "array of clusters is read-only; use replaceElements");
    }

    /** A fresh, default-valued cluster with the element layout. */
    public ClusterControl newElement() {
        return elementFactory.get();
    }

    /** Member names of the element layout. */
    public List<String> layout() {
        return layout;
    }

    /**
     * Installs elements built by the session layer. An element may hold the layout's members in another
     * order, as an error cluster does after an assignment in its canonical order.
     *
     * @throws ControlTypeException when an element's members differ from the element layout
     */
    public void replaceElements(List<ClusterControl> elements) {
        Objects.requireNonNull(elements, "elements");
        for (ClusterControl element : elements) {
            if (element == null || !hasLayoutMembers(element)) {
                throw ControlTypeException.rejected(
                    this, element == null ? null : element.names(), "element layout must be " + layout);
            }
        }
        this.elements = List.copyOf(elements);
    }

    private boolean hasLayoutMembers(ClusterControl element) {
        List<String> names = element.names();
        return names.size() == layout.size() && members.equals(Set.copyOf(names));
    }

    public int size() {
        return elements.size();
    }

    public ClusterControl get(int index) {
        if (index < 0 || index >= elements.size()) {
            throw new UnknownControlException(
                "'" + name() + "' has no element at position " + index + " (size " + elements.size() + ")");
        }
        return elements.get(index);
    }

    /** Element values, one ordered list per element. */
    public List<List<Object>> values() {
        List<List<Object>> values = new ArrayList<>(elements.size());
        elements.forEach(element -> values.add(element.value()));
        return Collections.unmodifiableList(values);
    }

    @Override
    Object snapshot() {
        return elements;
    }

    @Override
    @SuppressWarnings("unchecked")
    void restore(Object snapshot) {
        this.elements = (List<ClusterControl>) snapshot;
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
