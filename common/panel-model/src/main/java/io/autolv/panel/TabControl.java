package io.autolv.panel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Tab control: an ordered set of named pages, each holding its own controls.
 * <p>
 * The value is the index of the selected page and may also be set by page name.
 */
public final class TabControl extends Control<Integer> implements Iterable<TabPage> {

    private final List<TabPage> pages;
    private final Map<String, TabPage> byName = new HashMap<>();
    private int selected;

    public TabControl(ControlAttributes attributes, List<TabPage> pages) {
        super(ControlKind.TAB_CONTROL, attributes);
        this.pages = List.copyOf(Objects.requireNonNull(pages, "pages"));
        for (TabPage page : this.pages) {
            if (byName.putIfAbsent(page.name(), page) != null) {
                throw new IllegalArgumentException("duplicate page '" + page.name() + "' in '" + name() + "'");
            }
        }
    }

    @Override
    public Integer value() {
        return selected;
    }

    @Override
    public void setValue(Object value) {
        if (value instanceof String pageName) {
            TabPage page = byName.get(pageName);
            if (page == null) {
                throw ControlTypeException.rejected(this, value, "not one of " + pageNames());
            }
            this.selected = pages.indexOf(page);
            return;
        }
        Integer index = Integers.exact(value);
        if (index == null || index < 0 || (!pages.isEmpty() && index >= pages.size())) {
            throw ControlTypeException.rejected(this, value, "not a page index or page name");
        }
        this.selected = index;
    }

    /**
     * @throws UnknownControlException when there is no such page
     */
    public TabPage page(String name) {
        TabPage page = byName.get(name);
        if (page == null) {
            throw new UnknownControlException("'" + name() + "' has no page named '" + name + "'");
        }
        return page;
    }

    /**
     * @throws UnknownControlException when the position is out of range
     */
    public TabPage page(int index) {
        if (index < 0 || index >= pages.size()) {
            throw new UnknownControlException(
                "'" + name() + "' has no page at position " + index + " (size " + pages.size() + ")");
        }
        return pages.get(index);
    }

    public boolean hasPage(String name) {
        return byName.containsKey(name);
    }

    public List<TabPage> pages() {
        return pages;
    }

    public List<String> pageNames() {
        List<String> names = new ArrayList<>(pages.size());
        pages.forEach(page -> names.add(page.name()));
        return Collections.unmodifiableList(names);
    }

    /** Every control on every page, page by page. */
    public List<Control<?>> controls() {
        List<Control<?>> controls = new ArrayList<>();
        pages.forEach(page -> page.forEach(controls::add));
        return Collections.unmodifiableList(controls);
    }

    /** Finds a control by name on any page. */
    public Optional<Control<?>> find(String controlName) {
        for (TabPage page : pages) {
            if (page.contains(controlName)) {
                return Optional.of(page.get(controlName));
            }
        }
        return Optional.empty();
    }

    @Override
    public Iterator<TabPage> iterator() {
        return pages.iterator();
    }

    @Override
    boolean valueEquals(Control<?> other) {
        TabControl that = (TabControl) other;
        return selected == that.selected && pages.equals(that.pages);
    }

    @Override
    public String toString() {
        return pages.isEmpty() ? String.valueOf(selected) : pages.get(selected).name();
    }
}
