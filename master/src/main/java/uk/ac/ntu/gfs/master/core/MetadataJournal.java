package uk.ac.ntu.gfs.master.core;

import uk.ac.ntu.gfs.common.protocol.ChunkInfo;

import java.util.List;

// failed writes are logged by the implementation and never undo the in-memory change
public interface MetadataJournal {

    void serverRegistered(String address);

    void fileCreated(String name);

    void chunkAllocated(String file, int index, ChunkInfo chunk);

    Snapshot load();

    record Snapshot(List<String> servers, List<FileRecord> files, List<ChunkInfo> chunks) {
        public static final Snapshot EMPTY = new Snapshot(List.of(), List.of(), List.of());
    }

    static MetadataJournal none() {
        return new MetadataJournal() {
            @Override public void serverRegistered(String address) {}
            @Override public void fileCreated(String name) {}
            @Override public void chunkAllocated(String file, int index, ChunkInfo chunk) {}
            @Override public Snapshot load() { return Snapshot.EMPTY; }
        };
    }
}
