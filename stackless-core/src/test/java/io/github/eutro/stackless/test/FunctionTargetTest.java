package io.github.eutro.stackless.test;

import io.github.eutro.stackless.bytecode.AttrId;
import io.github.eutro.stackless.bytecode.Bytecode;
import io.github.eutro.stackless.env.*;
import io.github.eutro.stackless.target.FunctionTarget;
import io.github.eutro.stackless.target.FunctionTargetData;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class FunctionTargetTest {
    @Test
    void testLocalTypes() {
        Utils u = new Utils();
        FunctionEnv fun = u.add();
        FunctionTargetData.Builder builder = Utils.initial(fun).toBuilder();
        assertEquals(2, builder.addLocal(Type.U8));
        FunctionTarget target = new FunctionTarget(fun, builder.build());

        assertEquals(3, target.getLocalCount());
        assertEquals(2, target.getUserLocalCount());
        assertEquals(Type.U64, target.getLocalType(0));
        assertEquals(Type.BOOL, target.getLocalType(1));
        assertEquals(Type.U8, target.getLocalType(2));
        assertThrows(IndexOutOfBoundsException.class, () -> target.getLocalType(5));
        assertThrows(IndexOutOfBoundsException.class, () -> target.getLocalType(3));
        assertThrows(IndexOutOfBoundsException.class, () -> target.getLocalName(3));
        assertThrows(IndexOutOfBoundsException.class, () -> target.getReturnType(1));
        assertEquals(Type.U64, target.getReturnType(0));
    }

    @Test
    void testLocalNames() {
        Utils u = new Utils();
        FunctionEnv fun = u.module.newFunction("names")
                .addParameter("x", Type.U64)
                .addLocal("y", Type.U64)
                .addLocal(Type.BOOL)
                .addLocal("y", Type.U8)
                .build();
        FunctionTargetData.Builder builder = Utils.initial(fun).toBuilder();
        builder.addLocal(Type.U64);
        FunctionTarget target = new FunctionTarget(fun, builder.build());

        for (int i = 0; i < target.getLocalCount(); i++) {
            if (i == 3) continue;
            assertEquals(Optional.of(i), target.getLocalIndex(target.getLocalName(i)));
        }
        assertEquals("$t2", target.displayLocal(2));
        assertEquals("$t4", target.displayLocal(4));
        // repeated source names resolve to the first declaration
        assertEquals(Optional.of(1), target.getLocalIndex("y"));
        assertEquals(Optional.of(4), target.getLocalIndex("$t4"));
        assertEquals(Optional.empty(), target.getLocalIndex("nope"));
    }

    @Test
    void testGeneratedNameCollision() {
        Utils u = new Utils();
        FunctionEnv fun = u.module.newFunction("clash")
                .addParameter("x", Type.U64)
                .addLocal("$t2", Type.U64)
                .build();
        FunctionTargetData.Builder builder = Utils.initial(fun).toBuilder();
        builder.addLocal(Type.U64);
        FunctionTargetData data = builder.build();
        assertThrows(IllegalStateException.class, () -> new FunctionTarget(fun, data));
    }

    @Test
    void testCallEndsLifetime() {
        Utils u = new Utils();
        FunctionEnv f = u.module.newFunction("f")
                .setPublic(true)
                .addTypeParameter("T", TypeParameter.Constraint.NONE)
                .addParameter("x", Type.mutRef(Type.typeParam(0)))
                .addReturn(Type.typeParam(0))
                .build();
        FunctionEnv g = u.module.newFunction("g")
                .setPublic(true)
                .addTypeParameter("T", TypeParameter.Constraint.NONE)
                .addReturn(Type.ref(Type.typeParam(0)))
                .build();
        FunctionEnv hidden = u.module.newFunction("hidden")
                .addReturn(Type.U64)
                .build();
        FunctionEnv unit = u.module.newFunction("unit")
                .setPublic(true)
                .build();

        assertTrue(Utils.target(f, Collections.emptyList()).callEndsLifetime());
        assertFalse(Utils.target(g, Collections.emptyList()).callEndsLifetime());
        assertFalse(Utils.target(hidden, Collections.emptyList()).callEndsLifetime());
        assertTrue(Utils.target(unit, Collections.emptyList()).callEndsLifetime());
    }

    @Test
    void testClassification() {
        Utils u = new Utils();
        FunctionEnv fun = u.module.newFunction("native_fn")
                .setNative(true)
                .addParameter("r", Type.mutRef(u.resourceType()))
                .addAcquires(u.resource.getId())
                .build();
        FunctionTarget target = Utils.target(fun, Collections.emptyList());
        assertTrue(target.isNative());
        assertFalse(target.isPublic());
        assertTrue(target.isMutating());
        assertEquals(Collections.singletonList(u.resource.getId()), target.getAcquiresGlobalResources());
        assertSame(u.module, target.getModule());
        assertSame(u.env, target.globalEnv());
        assertEquals("native_fn", target.getName().display(target.symbolPool()));
    }

    @Test
    void testBytecodeLoc() {
        Utils u = new Utils();
        Loc funLoc = new Loc("test.move", 10, 80);
        FunctionEnv fun = u.module.newFunction("located").setLoc(funLoc).build();
        AttrId mapped = u.attr();
        AttrId unmapped = u.attr();
        Loc nopLoc = new Loc("test.move", 20, 25);
        FunctionTarget target = new FunctionTarget(fun, FunctionTargetData.initial(
                fun,
                Arrays.asList(new Bytecode.Nop(mapped), new Bytecode.Nop(unmapped)),
                Collections.singletonMap(mapped, nopLoc),
                Collections.emptyMap()
        ));
        assertEquals(nopLoc, target.getBytecodeLoc(mapped));
        assertEquals(funLoc, target.getBytecodeLoc(unmapped));
        assertEquals(funLoc, target.getLoc());
    }

    @Test
    void testBytecodeLocFollowsAttrAcrossRewrites() {
        Utils u = new Utils();
        Loc funLoc = new Loc("f", 0, 100);
        FunctionEnv fun = u.module.newFunction("moved").setLoc(funLoc).build();
        AttrId a = u.attr();
        AttrId b = u.attr();
        AttrId x = u.attr();
        Bytecode nopA = new Bytecode.Nop(a);
        Bytecode nopB = new Bytecode.Nop(b);
        FunctionTargetData initial = FunctionTargetData.initial(
                fun,
                Arrays.asList(nopA, nopB),
                Collections.singletonMap(a, new Loc("f", 1, 2)),
                Collections.emptyMap()
        );

        FunctionTargetData.Builder reordered = initial.toBuilder();
        reordered.setCode(Arrays.asList(nopB, new Bytecode.Nop(x), nopA));
        reordered.putLocation(b, new Loc("f", 3, 4));
        FunctionTargetData next = reordered.build();
        FunctionTargetData.checkSuccessor(initial, next);
        FunctionTarget target = new FunctionTarget(fun, next);
        assertEquals(new Loc("f", 1, 2), target.getBytecodeLoc(target.getBytecode().get(2).getAttrId()));
        assertEquals(new Loc("f", 3, 4), target.getBytecodeLoc(target.getBytecode().get(0).getAttrId()));
        assertEquals(funLoc, target.getBytecodeLoc(x));

        FunctionTargetData.Builder replaced = next.toBuilder();
        replaced.setLocations(Collections.singletonMap(x, new Loc("f", 5, 6)));
        FunctionTarget last = new FunctionTarget(fun, replaced.build());
        assertEquals(new Loc("f", 5, 6), last.getBytecodeLoc(x));
        assertEquals(funLoc, last.getBytecodeLoc(a));
        assertEquals(funLoc, last.getBytecodeLoc(b));
        assertEquals(new Loc("f", 1, 2), target.getBytecodeLoc(a));
    }

    @Test
    void testPragmas() {
        Utils u = new Utils();
        FunctionEnv fun = u.module.newFunction("p")
                .setSpec(Spec.builder()
                        .setProperties(Pragmas.builder().set("opaque", true).build())
                        .build())
                .build();
        FunctionTarget target = Utils.target(fun, Collections.emptyList());
        assertTrue(target.isPragmaTrue("opaque", () -> false));
        assertFalse(target.isPragmaTrue("verify", () -> false));
        assertTrue(target.isPragmaTrue("verify", () -> true));
    }

    @Test
    void testReturnIndex() {
        Utils u = new Utils();
        FunctionEnv fun = u.module.newFunction("swap")
                .addParameter("r", Type.mutRef(Type.U64))
                .addParameter("v", Type.U64)
                .build();
        FunctionTargetData.Builder builder = Utils.initial(fun).toBuilder();
        int ret = builder.addReturnType(Type.U64);
        builder.putRefParam(0, ret);
        FunctionTarget target = new FunctionTarget(fun, builder.build());
        assertEquals(Optional.of(0), target.getReturnIndex(0));
        assertEquals(Optional.empty(), target.getReturnIndex(1));
        assertEquals(1, target.getReturnCount());
    }

    @Test
    void testFormatterRegistry() {
        Utils u = new Utils();
        FunctionTarget target = Utils.target(u.add(), Collections.emptyList());
        assertTrue(target.getAnnotationFormatters().isEmpty());
        target.registerAnnotationFormattersForTest();
        assertEquals(6, target.getAnnotationFormatters().size());
        assertThrows(UnsupportedOperationException.class, () -> target.getAnnotationFormatters().clear());
    }
}
