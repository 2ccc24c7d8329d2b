package uk.ac.ntu.gfs.launcher;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModeTest {

    @Test
    void testParse() {
        assertEquals(Mode.MASTER, Mode.parse("master"));
        assertEquals(Mode.STORAGE_SERVER, Mode.parse("storageserver"));
        assertEquals(Mode.STORAGE_SERVER, Mode.parse("chunkserver"));
        assertEquals(Mode.CLIENT, Mode.parse(" Client "));
    }

    @Test
    void testUnknownMode() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Mode.parse("worker"));
        assertTrue(e.getMessage().contains("worker"));
        assertThrows(IllegalArgumentException.class, () -> Mode.parse(null));
    }
}
