package io.autolv.panel;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * LabVIEW's error cluster. Its exported member order can disagree with the order the session hands
 * values over in, so a failed positional assignment to a cluster with exactly these members is retried
 * once in {@link #CANONICAL_ORDER}. No other layout gets a retry.
 */
public final class ErrorClusterLayout {

    public static final List<String> CANONICAL_ORDER = List.of("status", "code", "source");

    private static final Set<String> MEMBERS = Set.copyOf(CANONICAL_ORDER);

    private ErrorClusterLayout() {
    }

    public static boolean matches(Collection<String> names) {
        return names.size() == MEMBERS.size() && MEMBERS.equals(Set.copyOf(names));
    }
}
