package io.github.eutro.stackless.test;

import io.github.eutro.stackless.env.*;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class FunctionEnvTest {
    @Test
    void testLocals() {
        GlobalEnv env = new GlobalEnv();
        ModuleEnv module = env.addModule("M");
        FunctionEnv fun = module.newFunction("f")
                .addParameter("x", Type.mutRef(Type.U64))
                .addParameter("y", Type.BOOL)
                .addLocal("z", Type.U64)
                .addLocal(Type.U8)
                .addReturn(Type.U64)
                .build();

        assertEquals("M::f", fun.getFullName());
        assertEquals(2, fun.getParameterCount());
        assertEquals(4, fun.getLocalCount());
        assertEquals("x", fun.getLocalName(0).display(fun.symbolPool()));
        assertEquals("z", fun.getLocalName(2).display(fun.symbolPool()));
        assertFalse(fun.hasDeclaredName(3));
        assertEquals("$t3", fun.getLocalName(3).display(fun.symbolPool()));
        assertEquals("$t7", fun.getLocalName(7).display(fun.symbolPool()));
        assertThrows(IndexOutOfBoundsException.class, () -> fun.getLocalName(-1));
        assertTrue(fun.isMutating());
        assertSame(fun, module.findFunction("f").orElseThrow(AssertionError::new));
    }

    @Test
    void testBuilderChecks() {
        GlobalEnv env = new GlobalEnv();
        ModuleEnv module = env.addModule("M");
        assertThrows(IllegalArgumentException.class, () -> env.addModule("M"));
        assertThrows(IllegalStateException.class, () -> module.newFunction("f")
                .addLocal("a", Type.U64)
                .addParameter("b", Type.U64));
        StructEnv other = env.addModule("N").addStruct("R", true);
        assertThrows(NoSuchElementException.class, () -> module.newFunction("g").addAcquires(other.getId()));

        module.newFunction("h").build();
        assertThrows(IllegalArgumentException.class, () -> module.newFunction("h").build());
    }

    @Test
    void testPragmaChain() {
        GlobalEnv env = new GlobalEnv();
        ModuleEnv module = env.addModule("M", Pragmas.builder()
                .set("verify", false)
                .set("timeout", 40)
                .build());
        FunctionEnv plain = module.newFunction("plain").build();
        FunctionEnv overriding = module.newFunction("overriding")
                .setSpec(Spec.builder()
                        .setProperties(Pragmas.builder().set("verify", true).build())
                        .build())
                .build();

        AtomicInteger defaults = new AtomicInteger();
        assertFalse(plain.isPragmaTrue("verify", () -> {
            defaults.incrementAndGet();
            return true;
        }));
        assertTrue(overriding.isPragmaTrue("verify", () -> false));
        assertEquals(0, defaults.get());

        // not a boolean, so the default decides
        assertTrue(plain.isPragmaTrue("timeout", () -> true));
        assertFalse(plain.isPragmaTrue("missing", () -> false));
    }
}
