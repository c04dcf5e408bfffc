package io.autolv.panel;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One page of a tab control. Pages only group controls; they have no value of their own.
 */
public final class TabPage implements ControlContainer {

    private final String name;
    private final OrderedControls controls;

    public TabPage(String name, List<? extends Control<?>> controls) {
        this.name = Objects.requireNonNull(name, "name");
        this.controls = new OrderedControls(name, controls);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Control<?> get(String name) {
        return controls.get(name);
    }

    @Override
    public Control<?> get(int index) {
        return controls.get(index);
    }

    @Override
    public <T extends Control<?>> T get(String name, Class<T> type) {
        return controls.get(name, Objects.requireNonNull(type, "type"));
    }

    @Override
    public boolean contains(String name) {
        return controls.contains(name);
    }

    @Override
    public int indexOf(String name) {
        return controls.indexOf(name);
    }

    @Override
    public List<String> names() {
        return controls.names();
    }

    @Override
    public int size() {
        return controls.size();
    }

    @Override
    public Map<String, Control<?>> asMap() {
        return controls.asMap();
    }

    @Override
    public Iterator<Control<?>> iterator() {
        return controls.iterator();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TabPage that)) {
            return false;
        }
        return name.equals(that.name) && controls.sameMembers(that.controls);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name + controls;
    }
}
