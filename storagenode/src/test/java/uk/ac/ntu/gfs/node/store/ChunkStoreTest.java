package uk.ac.ntu.gfs.node.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.ac.ntu.gfs.common.error.ErrorKind;
import uk.ac.ntu.gfs.common.error.GfsException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ChunkStoreTest {

    @TempDir
    Path tempDir;

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testStoreWritesMemoryAndDisk() throws Exception {
        ChunkStore store = new ChunkStore(tempDir.resolve("node"));
        store.store("chunk_1", bytes("hello"));

        assertArrayEquals(bytes("hello"), store.retrieve("chunk_1"));
        assertArrayEquals(bytes("hello"), Files.readAllBytes(tempDir.resolve("node").resolve("chunk_1")));
    }

    @Test
    void testStoreOverwrites() throws Exception {
        ChunkStore store = new ChunkStore(tempDir);
        store.store("chunk_1", bytes("first version"));
        store.store("chunk_1", bytes("second"));

        assertArrayEquals(bytes("second"), store.retrieve("chunk_1"));
        assertArrayEquals(bytes("second"), Files.readAllBytes(tempDir.resolve("chunk_1")));
    }

    @Test
    void testMissFallsBackToDiskAndBackfills() throws Exception {
        new ChunkStore(tempDir).store("chunk_9", bytes("persisted"));

        // a fresh store over the same directory starts with an empty cache
        ChunkStore restarted = new ChunkStore(tempDir);
        assertFalse(restarted.cached("chunk_9"));

        assertArrayEquals(bytes("persisted"), restarted.retrieve("chunk_9"));
        assertTrue(restarted.cached("chunk_9"));
    }

    @Test
    void testUnknownChunkIsNotFound() throws Exception {
        ChunkStore store = new ChunkStore(tempDir);
        GfsException e = assertThrows(GfsException.class, () -> store.retrieve("chunk_404"));
        assertEquals(ErrorKind.NOT_FOUND, e.kind());
    }

    @Test
    void testDiskFailureKeepsMemoryCopy() throws Exception {
        ChunkStore store = new ChunkStore(tempDir);
        // a directory where the chunk file should go makes the disk write fail
        Files.createDirectories(store.pathFor("chunk_2"));

        store.store("chunk_2", bytes("only in memory"));

        assertArrayEquals(bytes("only in memory"), store.retrieve("chunk_2"));
        assertTrue(Files.isDirectory(tempDir.resolve("chunk_2")));
    }

    @Test
    void testHandlesCannotEscapeDataDirectory() throws Exception {
        Path dataDir = tempDir.resolve("node");
        ChunkStore store = new ChunkStore(dataDir);

        store.store("../evil", bytes("x"));

        assertFalse(Files.exists(tempDir.resolve("evil")));
        assertEquals(dataDir.resolve("%2E%2E%2Fevil"), store.pathFor("../evil"));
        assertArrayEquals(bytes("x"), new ChunkStore(dataDir).retrieve("../evil"));
    }

    @Test
    void testEmptyChunk() throws Exception {
        ChunkStore store = new ChunkStore(tempDir);
        store.store("chunk_0", new byte[0]);
        assertEquals(0, new ChunkStore(tempDir).retrieve("chunk_0").length);
    }

    @Test
    void testSimilarHandlesGetDistinctFiles() throws Exception {
        ChunkStore store = new ChunkStore(tempDir);
        store.store("a_b", bytes("A"));
        store.store("a.b", bytes("B"));
        store.store("a%2Eb", bytes("C"));

        assertNotEquals(store.pathFor("a_b"), store.pathFor("a.b"));
        assertNotEquals(store.pathFor("a.b"), store.pathFor("a%2Eb"));

        ChunkStore restarted = new ChunkStore(tempDir);
        assertArrayEquals(bytes("A"), restarted.retrieve("a_b"));
        assertArrayEquals(bytes("B"), restarted.retrieve("a.b"));
        assertArrayEquals(bytes("C"), restarted.retrieve("a%2Eb"));
    }

    @Test
    void testFileNameKeepsPlainHandles() {
        assertEquals("chunk_12", ChunkStore.fileName("chunk_12"));
        assertEquals("x-Y_9", ChunkStore.fileName("x-Y_9"));
        assertEquals("a%25b", ChunkStore.fileName("a%b"));
        assertEquals("%C3%A9", ChunkStore.fileName("\u00e9"));
    }

    @Test
    void testMissesDoNotGrowLockTable() throws Exception {
        ChunkStore store = new ChunkStore(tempDir);
        int before = store.locks().size();
        for (int i = 0; i < 1000; i++) {
            String handle = "missing_" + i;
            GfsException e = assertThrows(GfsException.class, () -> store.retrieve(handle));
            assertEquals(ErrorKind.NOT_FOUND, e.kind());
        }
        assertEquals(before, store.locks().size());
        assertSame(store.locks().lockFor("chunk_1"), store.locks().lockFor("chunk_1"));
    }

    @Test
    void testCallerCannotMutateStoredChunk() throws Exception {
        ChunkStore store = new ChunkStore(tempDir);
        byte[] input = bytes("abc");
        store.store("chunk_1", input);
        input[0] = 'X';

        byte[] out = store.retrieve("chunk_1");
        out[1] = 'Y';

        assertArrayEquals(bytes("abc"), store.retrieve("chunk_1"));
        assertArrayEquals(bytes("abc"), Files.readAllBytes(store.pathFor("chunk_1")));
    }

    @Test
    void testConcurrentStoreAndRetrieveSeeWholePayloads() throws Exception {
        ChunkStore store = new ChunkStore(tempDir);
        List<byte[]> payloads = List.of(bytes("a"), bytes("bbbbbbbbbb"), new byte[64 * 1024], bytes("cc"));
        store.store("chunk_1", payloads.get(0));

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        Set<String> bad = ConcurrentHashMap.newKeySet();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int id = t;
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < 200; i++) {
                        if (id % 2 == 0) {
                            store.store("chunk_1", payloads.get((id + i) % payloads.size()));
                        } else {
                            byte[] got = store.retrieve("chunk_1");
                            if (!matchesSome(payloads, got)) {
                                bad.add("len=" + got.length);
                            }
                        }
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertTrue(bad.isEmpty(), "torn reads: " + bad);
        byte[] memoryCopy = store.retrieve("chunk_1");
        assertArrayEquals(memoryCopy, Files.readAllBytes(store.pathFor("chunk_1")));
        assertTrue(matchesSome(payloads, memoryCopy));
    }

    private static boolean matchesSome(List<byte[]> payloads, byte[] got) {
        for (byte[] p : payloads) {
            if (Arrays.equals(p, got)) return true;
        }
        return false;
    }
}
