package io.github.eutro.stackless.test;

import io.github.eutro.stackless.env.Symbol;
import io.github.eutro.stackless.env.SymbolPool;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolPoolTest {
    @Test
    void testInterning() {
        SymbolPool pool = new SymbolPool();
        Symbol a = pool.make("a");
        Symbol b = pool.make("b");
        assertSame(a, pool.make("a"));
        assertNotSame(a, b);
        assertEquals(2, pool.size());
        assertEquals("a", a.display(pool));
        assertEquals("b", pool.string(b));
    }

    @Test
    void testForeignSymbol() {
        SymbolPool pool = new SymbolPool();
        SymbolPool other = new SymbolPool();
        other.make("x");
        Symbol y = other.make("y");
        assertThrows(IllegalArgumentException.class, () -> pool.string(y));
    }
}
