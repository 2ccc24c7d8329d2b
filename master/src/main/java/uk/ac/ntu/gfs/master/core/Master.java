package uk.ac.ntu.gfs.master.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.gfs.common.error.GfsException;
import uk.ac.ntu.gfs.common.protocol.ChunkInfo;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The coordinator: owns the namespace and chunk table and decides where new chunks live.
 * It never sees chunk bytes.
 *
 * <p>All state sits in one {@link Namespace} behind one read/write lock. Register, create and
 * allocate take the write lock; location lookups take the read lock, so a reader never sees a
 * half-applied allocation.
 */
public final class Master {
    private static final Logger log = LoggerFactory.getLogger(Master.class);

    private final Namespace ns = new Namespace();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final PlacementPolicy placement;
    private final int replicationFactor;
    private final Duration leaseDuration;
    private final Clock clock;
    private final MetadataJournal journal;

    public Master(PlacementPolicy placement, int replicationFactor, Duration leaseDuration,
                  Clock clock, MetadataJournal journal) {
        if (replicationFactor <= 0) throw new IllegalArgumentException("replicationFactor must be positive");
        this.placement = placement;
        this.replicationFactor = replicationFactor;
        this.leaseDuration = leaseDuration;
        this.clock = clock;
        this.journal = journal;

        ns.restore(journal.load());
        if (ns.fileCount() > 0 || !ns.servers().isEmpty()) {
            log.info("Restored metadata: files={} chunks={} servers={}",
                    ns.fileCount(), ns.chunkCount(), ns.servers().size());
        }
    }

    public void registerServer(String address) throws GfsException {
        if (address == null || address.isBlank()) throw GfsException.badRequest("server address required");

        var w = lock.writeLock();
        w.lock();
        try {
            if (ns.addServer(address)) {
                journal.serverRegistered(address);
                log.info("Registered chunkserver: {}", address);
            }
        } finally {
            w.unlock();
        }
    }

    public void createFile(String path) throws GfsException {
        if (path == null || path.isEmpty()) throw GfsException.badRequest("file path required");

        var w = lock.writeLock();
        w.lock();
        try {
            if (ns.file(path) != null) throw GfsException.conflict("file already exists: " + path);
            ns.putFile(new FileRecord(path));
            journal.fileCreated(path);
            log.info("Created file: {}", path);
        } finally {
            w.unlock();
        }
    }

    public ChunkInfo allocateChunk(String path) throws GfsException {
        if (path == null || path.isEmpty()) throw GfsException.badRequest("file path required");

        var w = lock.writeLock();
        w.lock();
        try {
            FileRecord file = ns.file(path);
            if (file == null) throw GfsException.notFound("file not found: " + path);

            List<String> servers = placement.select(ns.servers(), replicationFactor);
            if (servers.isEmpty()) throw GfsException.unavailable("no available servers");

            Instant leaseEnd = clock.instant().plus(leaseDuration);
            ChunkInfo chunk = new ChunkInfo(ns.nextHandle(), servers, 1, 0, servers.get(0), leaseEnd);

            ns.putChunk(chunk);
            int index = file.chunkCount();
            file.appendChunk(chunk.handle());
            journal.chunkAllocated(path, index, chunk);

            log.info("Allocated chunk {} for file {} on servers {}", chunk.handle(), path, servers);
            return chunk;
        } finally {
            w.unlock();
        }
    }

    public List<ChunkInfo> chunkLocations(String path) throws GfsException {
        if (path == null || path.isEmpty()) throw GfsException.badRequest("file path required");

        var r = lock.readLock();
        r.lock();
        try {
            FileRecord file = ns.file(path);
            if (file == null) throw GfsException.notFound("file not found: " + path);

            List<ChunkInfo> out = new ArrayList<>(file.chunkCount());
            for (String handle : file.chunks()) out.add(ns.chunk(handle));
            return out;
        } finally {
            r.unlock();
        }
    }

    public List<String> registeredServers() {
        var r = lock.readLock();
        r.lock();
        try {
            return ns.servers();
        } finally {
            r.unlock();
        }
    }

    public String placementName() { return placement.name(); }

    public int replicationFactor() { return replicationFactor; }
}
