package io.autolv.panel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * LabVIEW cluster.
 * <p>
 * A cluster looks like a name-keyed map but is a fixed-layout record: its members have a set order and
 * the session exchanges whole-cluster values positionally in that order. Members are reachable by name
 * and by position, the whole value reads as the ordered list of member values, and a whole value can
 * be written either as a name-keyed map or as a sequence matched to the current member order.
 */
public final class ClusterControl extends Control<List<Object>> implements ControlContainer {

    private static final Logger log = LoggerFactory.getLogger(ClusterControl.class);

    private final OrderedControls members;

    public ClusterControl(ControlAttributes attributes, List<? extends Control<?>> members) {
        super(ControlKind.CLUSTER, attributes);
        this.members = new OrderedControls(attributes.name(), members);
    }

    /** Member values in current member order. */
    @Override
    public List<Object> value() {
        List<Object> values = new ArrayList<>(members.size());
        members.forEach(member -> values.add(member.value()));
        return Collections.unmodifiableList(values);
    }

    /**
     * Accepts a name-keyed map (order independent), another cluster (matched by name) or a sequence
     * with one value per member in current member order. A failed assignment leaves every member as it
     * was.
     */
    @Override
    public void setValue(Object value) {
        if (value instanceof ClusterControl other) {
            Map<String, Object> byName = new LinkedHashMap<>();
            other.members.forEach(member -> byName.put(member.name(), member.value()));
            assignByName(byName);
        } else if (value instanceof Map<?, ?> map) {
            assignByName(map);
        } else if (Sequences.isSequence(value)) {
            assignByPosition(Sequences.toList(value));
        } else {
            throw ControlTypeException.rejected(this, value, "not a mapping or sequence of member values");
        }
    }

    /**
     * Writes the given members only.
     *
     * @throws UnknownControlException when a key names no member; nothing is written then
     */
    public void update(Map<?, ?> values) {
        assignByName(values);
    }

    private void assignByName(Map<?, ?> values) {
        for (Object name : values.keySet()) {
            members.get(String.valueOf(name));
        }
        Map<String, Object> before = memberSnapshots();
        try {
            values.forEach((name, memberValue) -> members.get(String.valueOf(name)).setValue(memberValue));
        } catch (ControlException ex) {
            restoreMembers(before);
            throw ex;
        }
    }

    private void assignByPosition(List<Object> values) {
        if (values.size() != members.size()) {
            throw ControlTypeException.rejected(
                this, values, "expected " + members.size() + " values in order " + members.names());
        }
        Map<String, Object> before = memberSnapshots();
        try {
            applyInOrder(values);
        } catch (ControlTypeException ex) {
            restoreMembers(before);
            if (!needsErrorClusterOrder()) {
                throw ex;
            }
            retryInErrorClusterOrder(values, before, ex);
        } catch (ControlException ex) {
            restoreMembers(before);
            throw ex;
        }
    }

    private boolean needsErrorClusterOrder() {
        return ErrorClusterLayout.matches(members.names())
            && !ErrorClusterLayout.CANONICAL_ORDER.equals(members.names());
    }

    private void retryInErrorClusterOrder(List<Object> values, Map<String, Object> before, ControlTypeException cause) {
        List<String> previousOrder = members.names();
        log.debug("Retrying assignment to error cluster '{}' in order {} (was {})",
            name(), ErrorClusterLayout.CANONICAL_ORDER, previousOrder);
        members.reorder(ErrorClusterLayout.CANONICAL_ORDER);
        try {
            applyInOrder(values);
        } catch (ControlException retryFailure) {
            restoreMembers(before);
            members.reorder(previousOrder);
            cause.addSuppressed(retryFailure);
            throw cause;
        }
    }

    private void applyInOrder(List<Object> values) {
        for (int i = 0; i < values.size(); i++) {
            members.get(i).setValue(values.get(i));
        }
    }

    private Map<String, Object> memberSnapshots() {
        Map<String, Object> snapshots = new LinkedHashMap<>();
        members.forEach(member -> snapshots.put(member.name(), member.snapshot()));
        return snapshots;
    }

    private void restoreMembers(Map<String, Object> snapshots) {
        snapshots.forEach((name, snapshot) -> members.get(name).restore(snapshot));
    }

    @Override
    Object snapshot() {
        return memberSnapshots();
    }

    @Override
    @SuppressWarnings("unchecked")
    void restore(Object snapshot) {
        restoreMembers((Map<String, Object>) snapshot);
    }

    /**
     * Overrides the member order.
     *
     * @param names every current member name exactly once
     * @throws UnknownControlException when a name is not a member
     * @throws IllegalArgumentException when a member is omitted or listed twice
     */
    public void reorder(List<String> names) {
        members.reorder(names);
    }

    public void reorder(String... names) {
        reorder(Arrays.asList(names));
    }

    @Override
    public Control<?> get(String name) {
        return members.get(name);
    }

    @Override
    public Control<?> get(int index) {
        return members.get(index);
    }

    @Override
    public <T extends Control<?>> T get(String name, Class<T> type) {
        return members.get(name, Objects.requireNonNull(type, "type"));
    }

    @Override
    public boolean contains(String name) {
        return members.contains(name);
    }

    @Override
    public int indexOf(String name) {
        return members.indexOf(name);
    }

    @Override
    public List<String> names() {
        return members.names();
    }

    @Override
    public int size() {
        return members.size();
    }

    @Override
    public Map<String, Control<?>> asMap() {
        return members.asMap();
    }

    @Override
    public Iterator<Control<?>> iterator() {
        return members.iterator();
    }

    @Override
    boolean valueEquals(Control<?> other) {
        return members.sameMembers(((ClusterControl) other).members);
    }

    @Override
    public String toString() {
        return members.toString();
    }
}
