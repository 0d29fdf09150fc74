package io.github.eutro.stackless.test;

import io.github.eutro.stackless.annotations.*;
import io.github.eutro.stackless.bytecode.*;
import io.github.eutro.stackless.display.FunctionTargetDisplay;
import io.github.eutro.stackless.env.FunctionEnv;
import io.github.eutro.stackless.env.Type;
import io.github.eutro.stackless.env.TypeParameter;
import io.github.eutro.stackless.target.AnnotationFormatter;
import io.github.eutro.stackless.target.FunctionTarget;
import io.github.eutro.stackless.target.FunctionTargetData;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class FunctionTargetDisplayTest {
    /**
     * {@code Test::add} after a pass which introduced one temporary and annotated the code.
     */
    private static FunctionTarget annotatedAdd(Utils u) {
        FunctionEnv fun = u.add();
        FunctionTargetData.Builder builder = Utils.initial(fun).toBuilder();
        int tmp = builder.addLocal(Type.U64);
        builder.setCode(Arrays.asList(
                new Bytecode.Load(u.attr(), tmp, Constant.u64(1)),
                new Bytecode.Call(u.attr(), Collections.singletonList(tmp), Operation.of(Operation.Kind.ADD), Arrays.asList(0, tmp)),
                new Bytecode.Ret(u.attr(), tmp)
        ));
        Map<Integer, LiveVarAnnotation.LiveVarInfo> liveVars = new HashMap<>();
        liveVars.put(0, new LiveVarAnnotation.LiveVarInfo(Collections.singleton(0), Arrays.asList(0, tmp)));
        liveVars.put(1, new LiveVarAnnotation.LiveVarInfo(Arrays.asList(0, tmp), Collections.singleton(tmp)));
        builder.annotations().set(AnnotationKinds.LIVE_VARS, new LiveVarAnnotation(liveVars));
        builder.annotations().set(AnnotationKinds.REACHING_DEFS, new ReachingDefAnnotation(
                Collections.singletonMap(1, Collections.singletonMap(tmp,
                        Collections.singleton(ReachingDefAnnotation.Def.constant(Constant.u64(1)))))));
        builder.annotations().set(AnnotationKinds.WRITE_BACK, new WriteBackAnnotation(Collections.emptyMap()));
        return new FunctionTarget(fun, builder.build());
    }

    @Test
    void testRender() {
        FunctionTarget target = annotatedAdd(new Utils());
        target.registerAnnotationFormattersForTest();
        assertEquals("fun Test::add(a: u64, b: bool): u64 {\n" +
                        "    var $t2: u64\n" +
                        "    // live vars: a, $t2\n" +
                        "    $t2 := 1\n" +
                        "    // live vars: $t2\n" +
                        "    // reach: $t2 -> {1}\n" +
                        "    $t2 := +(a, $t2)\n" +
                        "    return $t2\n" +
                        "}\n",
                FunctionTargetDisplay.display(target));
        assertEquals(FunctionTargetDisplay.display(target), target.toString());
    }

    @Test
    void testRenderIsDeterministic() {
        FunctionTarget target = annotatedAdd(new Utils());
        target.registerAnnotationFormattersForTest();
        String first = FunctionTargetDisplay.display(target);
        String second = FunctionTargetDisplay.display(target);
        assertEquals(first, second);

        FunctionTarget rebound = new FunctionTarget(target.getFunctionEnv(), target.getData());
        rebound.registerAnnotationFormattersForTest();
        assertEquals(first, FunctionTargetDisplay.display(rebound));
    }

    @Test
    void testUnregisteredKindsAreNotRendered() {
        FunctionTarget target = annotatedAdd(new Utils());
        String plain = FunctionTargetDisplay.display(target);
        assertFalse(plain.contains("//"));

        FunctionTarget reachOnly = new FunctionTarget(target.getFunctionEnv(), target.getData());
        reachOnly.registerAnnotationFormatter(ReachingDefAnnotation::format);
        String rendered = FunctionTargetDisplay.display(reachOnly);
        assertTrue(rendered.contains("    // reach: $t2 -> {1}\n"));
        assertFalse(rendered.contains("live vars"));
    }

    @Test
    void testAllKinds() {
        Utils u = new Utils();
        FunctionEnv fun = u.module.newFunction("pair")
                .setPublic(true)
                .addTypeParameter("K", TypeParameter.Constraint.NONE)
                .addTypeParameter("V", TypeParameter.Constraint.COPYABLE)
                .addParameter("k", Type.mutRef(Type.typeParam(0)))
                .addParameter("v", Type.vector(Type.typeParam(1)))
                .addReturn(Type.typeParam(0))
                .addReturn(Type.ref(Type.typeParam(1)))
                .build();
        FunctionTargetData.Builder builder = Utils.initial(fun, new Bytecode.Nop(u.attr())).toBuilder();
        BorrowNode root = BorrowNode.localRoot(0);
        BorrowNode ref = BorrowNode.reference(0);
        builder.annotations().set(AnnotationKinds.BORROW, new BorrowAnnotation(Collections.singletonMap(0,
                new BorrowAnnotation.BorrowInfo(Arrays.asList(ref, root),
                        Collections.singletonMap(root, Collections.singleton(ref))))));
        builder.annotations().set(AnnotationKinds.WRITE_BACK, new WriteBackAnnotation(
                Collections.singletonMap(0, Collections.singleton(ref))));
        builder.annotations().set(AnnotationKinds.PACK_REF, new PackRefAnnotation(Collections.singletonMap(0,
                new PackRefAnnotation.PackRefInfo(Collections.singleton(0), Collections.emptySet()))));
        builder.annotations().set(AnnotationKinds.LIFETIME, new LifetimeAnnotation(
                Collections.singletonMap(0, new LifetimeAnnotation.Interval(0, 0))));
        FunctionTarget target = new FunctionTarget(fun, builder.build());
        target.registerAnnotationFormattersForTest();

        assertEquals("pub fun Test::pair<K, V>(k: &mut K, v: vector<V>): (K, &V) {\n" +
                        "    // live_nodes: LocalRoot(k), Reference(k); borrowed_by: LocalRoot(k) -> {Reference(k)}\n" +
                        "    // write_back: Reference(k)\n" +
                        "    // pack_refs: k\n" +
                        "    // lifetime begins: k; lifetime ends: k\n" +
                        "    nop\n" +
                        "}\n",
                FunctionTargetDisplay.display(target));
    }

    @Test
    void testVarLines() {
        Utils u = new Utils();
        FunctionEnv fun = u.module.newFunction("locals")
                .addParameter("x", Type.U64)
                .addParameter("y", Type.U64)
                .build();
        FunctionTargetData.Builder builder = Utils.initial(fun).toBuilder();
        builder.addLocal(Type.BOOL);
        builder.setCode(Arrays.asList(new Bytecode.Nop(u.attr()), new Bytecode.Ret(u.attr())));
        FunctionTarget target = new FunctionTarget(fun, builder.build());
        assertEquals("fun Test::locals(x: u64, y: u64) {\n" +
                        "    var $t2: bool\n" +
                        "    nop\n" +
                        "    return ()\n" +
                        "}\n",
                FunctionTargetDisplay.display(target));
    }

    @Test
    void testFormatterOrder() {
        FunctionTarget target = Utils.target(new Utils().add(), Collections.singletonList(new Bytecode.Nop(new AttrId(0))));
        AnnotationFormatter first = (t, offset) -> Optional.of("first");
        AnnotationFormatter multiLine = (t, offset) -> Optional.of("second\nthird");
        AnnotationFormatter silent = (t, offset) -> Optional.empty();
        target.registerAnnotationFormatter(first);
        target.registerAnnotationFormatter(silent);
        target.registerAnnotationFormatter(multiLine);
        target.registerAnnotationFormatter(first);
        assertEquals("fun Test::add(a: u64, b: bool): u64 {\n" +
                        "    // first\n" +
                        "    // second\n" +
                        "    // third\n" +
                        "    // first\n" +
                        "    nop\n" +
                        "}\n",
                FunctionTargetDisplay.display(target));
    }

    @Test
    void testEmptyFormatterTextIsSkipped() {
        FunctionTarget target = Utils.target(new Utils().add(), Collections.singletonList(new Bytecode.Nop(new AttrId(0))));
        target.registerAnnotationFormatter((t, offset) -> Optional.of(""));
        target.registerAnnotationFormatter((t, offset) -> Optional.of("a\n"));
        target.registerAnnotationFormatter((t, offset) -> Optional.of("\n"));
        assertEquals("fun Test::add(a: u64, b: bool): u64 {\n" +
                        "    // a\n" +
                        "    nop\n" +
                        "}\n",
                FunctionTargetDisplay.display(target));
    }

    @Test
    void testFailingFormatterPropagates() {
        FunctionTarget target = Utils.target(new Utils().add(), Collections.singletonList(new Bytecode.Nop(new AttrId(0))));
        IllegalStateException failure = new IllegalStateException("formatter failed");
        target.registerAnnotationFormatter((t, offset) -> {
            throw failure;
        });
        assertSame(failure, assertThrows(IllegalStateException.class, () -> FunctionTargetDisplay.display(target)));
    }

    @Test
    void testDisplayToFile(@TempDir Path dir) throws IOException {
        FunctionTarget target = annotatedAdd(new Utils());
        File file = dir.resolve("nested").resolve("add.txt").toFile();
        FunctionTargetDisplay.debugDisplayToFile(target, file);
        assertEquals(FunctionTargetDisplay.display(target),
                new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8));
    }
}
