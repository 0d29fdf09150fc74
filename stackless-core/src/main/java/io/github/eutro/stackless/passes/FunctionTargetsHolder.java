package io.github.eutro.stackless.passes;

import io.github.eutro.stackless.bytecode.AttrId;
import io.github.eutro.stackless.bytecode.Bytecode;
import io.github.eutro.stackless.bytecode.SpecBlockId;
import io.github.eutro.stackless.display.FunctionTargetDisplay;
import io.github.eutro.stackless.env.FunctionEnv;
import io.github.eutro.stackless.env.Loc;
import io.github.eutro.stackless.target.FunctionTarget;
import io.github.eutro.stackless.target.FunctionTargetData;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Holds the current snapshot of every function of a program, and the snapshots they replaced.
 * <p>
 * Every replacement is checked with {@link FunctionTargetData#checkSuccessor(FunctionTargetData, FunctionTargetData)}.
 * If a dump directory is set, each new snapshot is also rendered to
 * {@code <dir>/<module>_<function>_<n>_<stage>.txt}. A dump that cannot be written is logged
 * and does not undo the replacement.
 * <p>
 * A {@link ChainedProcessor} is one stage here: the snapshots between its steps are
 * neither kept in the history nor dumped.
 */
public class FunctionTargetsHolder {
    private static final Logger LOGGER = LoggerFactory.getLogger(FunctionTargetsHolder.class);

    public static String DUMP_DIR = System.getenv("STACKLESS_DUMP_DIR");

    private final Map<FunctionEnv, Lineage> targets = new LinkedHashMap<>();
    @Nullable
    private File dumpDirectory = DUMP_DIR == null ? null : new File(DUMP_DIR);

    private static class Lineage {
        final List<FunctionTargetData> history = new ArrayList<>();
        final List<String> stages = new ArrayList<>();
        FunctionTargetData current;

        Lineage(FunctionTargetData current) {
            this.current = current;
        }
    }

    public void setDumpDirectory(@Nullable File dumpDirectory) {
        this.dumpDirectory = dumpDirectory;
    }

    public @Nullable File getDumpDirectory() {
        return dumpDirectory;
    }

    public FunctionTargetData addTarget(FunctionEnv fun, List<Bytecode> code) {
        return addTarget(fun, code, Collections.emptyMap(), Collections.emptyMap());
    }

    /**
     * Add a function, building its initial snapshot from its declared code.
     *
     * @param fun             The function.
     * @param code            The code of the function.
     * @param locations       The source locations of the instructions.
     * @param givenSpecBlocks The spec blocks of the code, see
     *                        {@link FunctionTargetData#initial(FunctionEnv, List, Map, Map)}.
     * @return The initial snapshot.
     * @throws IllegalArgumentException If the function was already added.
     */
    public FunctionTargetData addTarget(
            FunctionEnv fun,
            List<Bytecode> code,
            Map<AttrId, Loc> locations,
            Map<SpecBlockId, Integer> givenSpecBlocks
    ) {
        if (targets.containsKey(fun)) {
            throw new IllegalArgumentException(fun.getFullName() + " was already added");
        }
        FunctionTargetData data = FunctionTargetData.initial(fun, code, locations, givenSpecBlocks);
        Lineage lineage = new Lineage(data);
        lineage.stages.add("initial");
        targets.put(fun, lineage);
        LOGGER.debug("added {} with {} instructions", fun.getFullName(), code.size());
        dump(fun, lineage);
        return data;
    }

    public boolean hasTarget(FunctionEnv fun) {
        return targets.containsKey(fun);
    }

    public Collection<FunctionEnv> getFunctions() {
        return Collections.unmodifiableSet(targets.keySet());
    }

    public FunctionTargetData getData(FunctionEnv fun) {
        return lineage(fun).current;
    }

    /**
     * Bind a new target to the current snapshot of a function.
     *
     * @param fun The function.
     * @return The target.
     */
    public FunctionTarget getTarget(FunctionEnv fun) {
        return new FunctionTarget(fun, getData(fun));
    }

    /**
     * Get the snapshots of a function which have been replaced, oldest first.
     *
     * @param fun The function.
     * @return The snapshots.
     */
    public List<FunctionTargetData> getHistory(FunctionEnv fun) {
        return Collections.unmodifiableList(lineage(fun).history);
    }

    /**
     * Get the names of the stages a function went through, starting with {@code initial}.
     *
     * @param fun The function.
     * @return The stage names.
     */
    public List<String> getStages(FunctionEnv fun) {
        return Collections.unmodifiableList(lineage(fun).stages);
    }

    /**
     * Run a processor on a function, replacing its current snapshot with the result.
     *
     * @param fun       The function.
     * @param processor The processor.
     * @return The new snapshot.
     * @throws IllegalStateException If the result is not a valid successor of the current snapshot.
     */
    public FunctionTargetData rewrite(FunctionEnv fun, FunctionTargetProcessor processor) {
        Lineage lineage = lineage(fun);
        FunctionTargetData prev = lineage.current;
        FunctionTargetData next = processor.process(new FunctionTarget(fun, prev));
        FunctionTargetData.checkSuccessor(prev, next);
        lineage.history.add(prev);
        lineage.stages.add(processor.getName());
        lineage.current = next;
        LOGGER.debug("{} on {}: {} -> {} instructions",
                processor.getName(), fun.getFullName(), prev.getCode().size(), next.getCode().size());
        dump(fun, lineage);
        return next;
    }

    /**
     * Run a processor on every function, in the order they were added.
     *
     * @param processor The processor.
     */
    public void rewriteAll(FunctionTargetProcessor processor) {
        for (FunctionEnv fun : targets.keySet()) {
            rewrite(fun, processor);
        }
    }

    private Lineage lineage(FunctionEnv fun) {
        Lineage lineage = targets.get(fun);
        if (lineage == null) {
            throw new IllegalArgumentException(fun.getFullName() + " has no target");
        }
        return lineage;
    }

    private void dump(FunctionEnv fun, Lineage lineage) {
        if (dumpDirectory == null) return;
        FunctionTarget target = new FunctionTarget(fun, lineage.current);
        target.registerAnnotationFormattersForTest();
        int stage = lineage.stages.size() - 1;
        String fileName = String.format("%s_%s_%d_%s.txt",
                fun.getModule().getName().display(fun.symbolPool()),
                fun.getName().display(fun.symbolPool()),
                stage,
                lineage.stages.get(stage).replaceAll("[^A-Za-z0-9_+-]", "_"));
        try {
            FunctionTargetDisplay.debugDisplayToFile(target, new File(dumpDirectory, fileName));
        } catch (UncheckedIOException e) {
            LOGGER.warn("could not dump {} to {}", fun.getFullName(), dumpDirectory, e);
        }
    }
}
