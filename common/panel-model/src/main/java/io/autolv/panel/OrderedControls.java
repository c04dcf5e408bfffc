package io.autolv.panel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Backing store shared by the containers: a name lookup table plus the member order.
 */
final class OrderedControls implements Iterable<Control<?>> {

    private final String owner;
    private final Map<String, Control<?>> byName = new HashMap<>();
    private final List<Control<?>> order = new ArrayList<>();

    OrderedControls(String owner, Collection<? extends Control<?>> controls) {
        this.owner = Objects.requireNonNull(owner, "owner");
        for (Control<?> control : Objects.requireNonNull(controls, "controls")) {
            if (byName.putIfAbsent(control.name(), control) != null) {
                throw new IllegalArgumentException("duplicate control '" + control.name() + "' in '" + owner + "'");
            }
            order.add(control);
        }
    }

    Control<?> get(String name) {
        Control<?> control = byName.get(name);
        if (control == null) {
            throw new UnknownControlException("'" + owner + "' has no control named '" + name + "'");
        }
        return control;
    }

    Control<?> get(int index) {
        if (index < 0 || index >= order.size()) {
            throw new UnknownControlException(
                "'" + owner + "' has no control at position " + index + " (size " + order.size() + ")");
        }
        return order.get(index);
    }

    <T extends Control<?>> T get(String name, Class<T> type) {
        Control<?> control = get(name);
        if (!type.isInstance(control)) {
            throw new UnknownControlException(
                "control '" + name + "' in '" + owner + "' is a " + control.kind().label()
                    + ", not a " + type.getSimpleName());
        }
        return type.cast(control);
    }

    boolean contains(String name) {
        return byName.containsKey(name);
    }

    int indexOf(String name) {
        return order.indexOf(get(name));
    }

    List<String> names() {
        List<String> names = new ArrayList<>(order.size());
        order.forEach(control -> names.add(control.name()));
        return Collections.unmodifiableList(names);
    }

    int size() {
        return order.size();
    }

    Map<String, Control<?>> asMap() {
        Map<String, Control<?>> map = new LinkedHashMap<>();
        order.forEach(control -> map.put(control.name(), control));
        return Collections.unmodifiableMap(map);
    }

    /**
     * Replaces the member order with a full permutation of the current names.
     */
    void reorder(List<String> names) {
        Objects.requireNonNull(names, "names");
        Set<String> seen = new HashSet<>();
        List<Control<?>> reordered = new ArrayList<>(names.size());
        for (String name : names) {
            Control<?> control = get(name);
            if (!seen.add(name)) {
                throw new IllegalArgumentException("'" + name + "' listed twice when reordering '" + owner + "'");
            }
            reordered.add(control);
        }
        if (reordered.size() != order.size()) {
            List<String> missing = new ArrayList<>(names());
            missing.removeAll(seen);
            throw new IllegalArgumentException("reordering '" + owner + "' omits " + missing);
        }
        order.clear();
        order.addAll(reordered);
    }

    @Override
    public Iterator<Control<?>> iterator() {
        return Collections.unmodifiableList(order).iterator();
    }

    boolean sameMembers(OrderedControls other) {
        return order.equals(other.order);
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder("{");
        for (Control<?> control : order) {
            if (text.length() > 1) {
                text.append(", ");
            }
            text.append(control.name()).append('=').append(control);
        }
        return text.append('}').toString();
    }
}
