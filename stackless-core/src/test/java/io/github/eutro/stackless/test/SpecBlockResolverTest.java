package io.github.eutro.stackless.test;

import io.github.eutro.stackless.bytecode.Bytecode;
import io.github.eutro.stackless.bytecode.SpecBlockId;
import io.github.eutro.stackless.env.*;
import io.github.eutro.stackless.target.FunctionTarget;
import io.github.eutro.stackless.target.FunctionTargetData;
import io.github.eutro.stackless.target.SpecBlockNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SpecBlockResolverTest {
    private static final Loc LOC = new Loc("test.move", 4, 9);

    @Test
    void testResolve() {
        Utils u = new Utils();
        Spec atZero = Spec.of(new Condition(LOC, Condition.Kind.ASSERT, "x > 0"));
        Spec atTwo = Spec.of(
                new Condition(LOC, Condition.Kind.ASSUME, "x < 10"),
                new Condition(LOC, Condition.Kind.ASSERT, "x != 5")
        );
        FunctionEnv fun = u.module.newFunction("checked")
                .addParameter("x", Type.U64)
                .setSpec(Spec.builder()
                        .addCondition(new Condition(LOC, Condition.Kind.REQUIRES, "x > 0"))
                        .addOnImpl(0, atZero)
                        .addOnImpl(2, atTwo)
                        .build())
                .build();

        SpecBlockId first = new SpecBlockId(0);
        SpecBlockId second = new SpecBlockId(1);
        Map<SpecBlockId, Integer> given = new HashMap<>();
        given.put(first, 0);
        given.put(second, 2);
        FunctionTargetData initial = FunctionTargetData.initial(
                fun,
                Arrays.asList(new Bytecode.SpecBlock(u.attr(), first), new Bytecode.SpecBlock(u.attr(), second)),
                Collections.emptyMap(),
                given
        );

        FunctionTargetData.Builder builder = initial.toBuilder();
        SpecBlockId generatedId = builder.newSpecBlockId();
        Spec generated = Spec.of(new Condition(LOC, Condition.Kind.ASSERT, "x == old(x)"));
        builder.addGeneratedSpecBlock(generatedId, generated);
        FunctionTarget target = new FunctionTarget(fun, builder.build());

        assertSame(atZero, target.getSpecOnImpl(first));
        assertSame(atTwo, target.getSpecOnImpl(second));
        assertSame(generated, target.getSpecOnImpl(generatedId));
        assertEquals(1, target.getSpec().getConditions().size());

        SpecBlockNotFoundException e = assertThrows(SpecBlockNotFoundException.class,
                () -> target.getSpecOnImpl(new SpecBlockId(7)));
        assertEquals(new SpecBlockId(7), e.getBlockId());

        // the initial snapshot never saw the generated block
        FunctionTarget before = new FunctionTarget(fun, initial);
        assertThrows(SpecBlockNotFoundException.class, () -> before.getSpecOnImpl(generatedId));
    }

    @Test
    void testDisplay() {
        Utils u = new Utils();
        FunctionEnv fun = u.module.newFunction("shown")
                .addParameter("x", Type.U64)
                .setSpec(Spec.builder()
                        .addOnImpl(0, Spec.of(
                                new Condition(LOC, Condition.Kind.ASSUME, "x < 10"),
                                new Condition(LOC, Condition.Kind.ASSERT, "x != 5")
                        ))
                        .build())
                .build();
        SpecBlockId id = new SpecBlockId(0);
        Bytecode block = new Bytecode.SpecBlock(u.attr(), id);
        FunctionTarget target = new FunctionTarget(fun, FunctionTargetData.initial(
                fun,
                Collections.singletonList(block),
                Collections.emptyMap(),
                Collections.singletonMap(id, 0)
        ));
        assertEquals("spec {assume x < 10; assert x != 5}", block.display(target));
    }
}
