package io.autolv.vistrings;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the {@link RepairPass}es in order over raw exported VI strings.
 */
public final class ViStringsPreprocessor {

    private static final Logger log = LoggerFactory.getLogger(ViStringsPreprocessor.class);

    private final List<RepairPass> passes;

    public ViStringsPreprocessor() {
        this(Arrays.asList(RepairPass.values()));
    }

    /**
     * Runs a subset of the passes, still in their declared order.
     */
    public ViStringsPreprocessor(List<RepairPass> passes) {
        this.passes = Objects.requireNonNull(passes, "passes").stream().sorted().distinct().toList();
    }

    public List<RepairPass> passes() {
        return passes;
    }

    public String repair(String exported) {
        Objects.requireNonNull(exported, "exported");
        String text = exported;
        for (RepairPass pass : passes) {
            int before = text.length();
            text = pass.apply(text);
            log.debug("{}: {} -> {} chars", pass, before, text.length());
        }
        return text;
    }
}
