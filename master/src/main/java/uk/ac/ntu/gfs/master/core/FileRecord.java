package uk.ac.ntu.gfs.master.core;

import java.util.ArrayList;
import java.util.List;

public final class FileRecord {
    private final String name;
    private final List<String> chunks;
    private long size;

    public FileRecord(String name) {
        this(name, List.of(), 0);
    }

    public FileRecord(String name, List<String> chunks, long size) {
        this.name = name;
        this.chunks = new ArrayList<>(chunks);
        this.size = size;
    }

    public String name() { return name; }

    public List<String> chunks() { return List.copyOf(chunks); }

    public long size() { return size; }

    public int chunkCount() { return chunks.size(); }

    void appendChunk(String handle) {
        chunks.add(handle);
    }
}
