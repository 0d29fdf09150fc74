package io.github.eutro.stackless.passes;

import io.github.eutro.stackless.target.FunctionTarget;
import io.github.eutro.stackless.target.FunctionTargetData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ListIterator;

/**
 * A processor which runs two others in sequence, binding a fresh {@link FunctionTarget}
 * to each intermediate snapshot.
 */
public class ChainedProcessor implements FunctionTargetProcessor {
    private final FunctionTargetProcessor first;
    private final FunctionTargetProcessor next;

    /**
     * Construct a chained processor.
     *
     * @param first The first processor to run.
     * @param next  The processor to run on the first one's result.
     */
    public ChainedProcessor(FunctionTargetProcessor first, FunctionTargetProcessor next) {
        this.first = first;
        this.next = next;
    }

    /**
     * Get the processors of this chain, flattened, in the order they run.
     *
     * @return The processors.
     */
    public List<FunctionTargetProcessor> listProcessors() {
        List<FunctionTargetProcessor> processors = new ArrayList<>();
        FunctionTargetProcessor processor = this;
        while (processor instanceof ChainedProcessor) {
            ChainedProcessor chained = (ChainedProcessor) processor;
            processors.addAll(reversed(chained.next));
            processor = chained.first;
        }
        processors.add(processor);
        Collections.reverse(processors);
        return processors;
    }

    private static List<FunctionTargetProcessor> reversed(FunctionTargetProcessor processor) {
        if (!(processor instanceof ChainedProcessor)) return Collections.singletonList(processor);
        List<FunctionTargetProcessor> processors = new ArrayList<>(((ChainedProcessor) processor).listProcessors());
        Collections.reverse(processors);
        return processors;
    }

    @Override
    public String getName() {
        return first.getName() + "+" + next.getName();
    }

    @Override
    public FunctionTargetData process(FunctionTarget target) {
        ListIterator<FunctionTargetProcessor> li = listProcessors().listIterator();
        FunctionTarget current = target;
        FunctionTargetData result = target.getData();
        while (li.hasNext()) {
            FunctionTargetProcessor processor = li.next();
            try {
                FunctionTargetData data = processor.process(current);
                FunctionTargetData.checkSuccessor(result, data);
                result = data;
            } catch (Throwable t) {
                t.addSuppressed(new RuntimeException("running processor " + li.previousIndex()
                        + " (" + processor.getName() + ") in chain"));
                throw t;
            }
            current = new FunctionTarget(target.getFunctionEnv(), result);
        }
        return result;
    }
}
