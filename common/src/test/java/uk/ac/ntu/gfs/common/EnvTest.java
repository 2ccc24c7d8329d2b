package uk.ac.ntu.gfs.common;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvTest {

    @Test
    void testFallbacksForMissingBlankAndInvalid() {
        Env env = new Env(Map.of("A", "  ", "B", "abc", "C", " 42 ", "D", " node "));

        assertEquals("x", env.string("A", "x"));
        assertEquals("x", env.string("MISSING", "x"));
        assertEquals("node", env.string("D", "x"));

        assertEquals(7, env.integer("B", 7));
        assertEquals(42, env.integer("C", 7));
        assertEquals(9L, env.longValue("A", 9L));
        assertEquals(42L, env.longValue("C", 9L));
    }
}
