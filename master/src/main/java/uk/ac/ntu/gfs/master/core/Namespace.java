package uk.ac.ntu.gfs.master.core;

import uk.ac.ntu.gfs.common.protocol.ChunkInfo;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

// not thread safe, Master guards it with one lock
final class Namespace {
    private static final String HANDLE_PREFIX = "chunk_";

    private final Map<String, FileRecord> files = new HashMap<>();
    private final Map<String, ChunkInfo> chunks = new HashMap<>();
    private final List<String> servers = new ArrayList<>();
    private long nextChunk = 1;

    boolean addServer(String address) {
        if (servers.contains(address)) return false;
        servers.add(address);
        return true;
    }

    List<String> servers() {
        return List.copyOf(servers);
    }

    FileRecord file(String name) {
        return files.get(name);
    }

    void putFile(FileRecord file) {
        files.put(file.name(), file);
    }

    ChunkInfo chunk(String handle) {
        return chunks.get(handle);
    }

    void putChunk(ChunkInfo chunk) {
        chunks.put(chunk.handle(), chunk);
    }

    String nextHandle() {
        return HANDLE_PREFIX + nextChunk++;
    }

    void restore(MetadataJournal.Snapshot snapshot) {
        snapshot.servers().forEach(this::addServer);
        for (ChunkInfo c : snapshot.chunks()) {
            putChunk(c);
            nextChunk = Math.max(nextChunk, handleNumber(c.handle()) + 1);
        }
        for (FileRecord f : snapshot.files()) {
            // a file pointing at a chunk the journal never stored would break lookups; drop the dangling tail
            List<String> kept = new ArrayList<>();
            for (String h : f.chunks()) {
                if (!chunks.containsKey(h)) break;
                kept.add(h);
            }
            putFile(new FileRecord(f.name(), kept, f.size()));
        }
    }

    int fileCount() { return files.size(); }

    int chunkCount() { return chunks.size(); }

    private static long handleNumber(String handle) {
        if (handle == null || !handle.startsWith(HANDLE_PREFIX)) return 0;
        try { return Long.parseLong(handle.substring(HANDLE_PREFIX.length())); }
        catch (NumberFormatException e) { return 0; }
    }
}
