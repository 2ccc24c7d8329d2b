package uk.ac.ntu.gfs.node.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.gfs.common.error.ErrorKind;
import uk.ac.ntu.gfs.common.error.GfsException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;

// a failed disk write is logged and the memory copy kept
public final class ChunkStore {
    private static final Logger log = LoggerFactory.getLogger(ChunkStore.class);

    private final Path baseDir;
    private final ConcurrentHashMap<String, byte[]> memory = new ConcurrentHashMap<>();
    private final ChunkLocks locks = new ChunkLocks();

    public ChunkStore(Path baseDir) throws IOException {
        this.baseDir = baseDir;
        Files.createDirectories(baseDir);
    }

    public Path baseDir() {
        return baseDir;
    }

    public void store(String handle, byte[] bytes) {
        byte[] data = bytes.clone();
        locks.withWrite(handle, () -> {
            memory.put(handle, data);
            try {
                Files.write(pathFor(handle), data, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            } catch (IOException e) {
                log.error("Failed to write chunk {} to disk (kept in memory): {}", handle, e.getMessage());
            }
            return null;
        });
    }

    public byte[] retrieve(String handle) throws GfsException {
        byte[] cached = locks.withRead(handle, () -> memory.get(handle));
        if (cached != null) return cached.clone();

        byte[] loaded = locks.<byte[], GfsException>withWrite(handle, () -> {
            byte[] again = memory.get(handle);
            if (again != null) return again;

            byte[] data;
            try {
                data = Files.readAllBytes(pathFor(handle));
            } catch (NoSuchFileException e) {
                throw GfsException.notFound("chunk not found: " + handle);
            } catch (IOException e) {
                throw new GfsException(ErrorKind.PERSISTENCE_FAILURE,
                        "failed to read chunk " + handle + ": " + e.getMessage(), e);
            }
            memory.put(handle, data);
            return data;
        });
        return loaded.clone();
    }

    boolean cached(String handle) {
        return memory.containsKey(handle);
    }

    ChunkLocks locks() {
        return locks;
    }

    Path pathFor(String handle) {
        return baseDir.resolve(fileName(handle));
    }

    // alphanum, dash and underscore kept; every other UTF-8 byte (including '%') becomes %XX
    static String fileName(String handle) {
        StringBuilder sb = new StringBuilder(handle.length());
        for (byte b : handle.getBytes(StandardCharsets.UTF_8)) {
            char c = (char) (b & 0xff);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_' || c == '-') {
                sb.append(c);
            } else {
                sb.append('%').append(String.format("%02X", b & 0xff));
            }
        }
        return sb.toString();
    }
}
