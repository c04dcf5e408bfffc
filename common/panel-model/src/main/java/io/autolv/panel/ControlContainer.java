package io.autolv.panel;

import java.util.List;
import java.util.Map;

/**
 * Ordered, name-keyed collection of child controls.
 * <p>
 * Positions are resolved against the current member order, which {@link ClusterControl#reorder} may
 * change.
 */
public interface ControlContainer extends Iterable<Control<?>> {

    String name();

    /**
     * @throws UnknownControlException when no child has this name
     */
    Control<?> get(String name);

    /**
     * @throws UnknownControlException when the position is out of range
     */
    Control<?> get(int index);

    /**
     * Looks up a child and checks its variant.
     *
     * @throws UnknownControlException when no child has this name or it is not a {@code type}
     */
    <T extends Control<?>> T get(String name, Class<T> type);

    boolean contains(String name);

    /**
     * @throws UnknownControlException when no child has this name
     */
    int indexOf(String name);

    List<String> names();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /** Children keyed by name, in member order. */
    Map<String, Control<?>> asMap();

    default void set(String name, Object value) {
        get(name).setValue(value);
    }

    default void set(int index, Object value) {
        get(index).setValue(value);
    }
}
