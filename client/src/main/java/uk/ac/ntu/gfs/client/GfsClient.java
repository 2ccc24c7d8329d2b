package uk.ac.ntu.gfs.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.gfs.common.error.ErrorKind;
import uk.ac.ntu.gfs.common.error.GfsException;
import uk.ac.ntu.gfs.common.net.PeerClient;
import uk.ac.ntu.gfs.common.net.PeerResponse;
import uk.ac.ntu.gfs.common.protocol.ChunkInfo;
import uk.ac.ntu.gfs.common.protocol.Json;
import uk.ac.ntu.gfs.common.protocol.Protocol;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

public final class GfsClient {
    private static final Logger log = LoggerFactory.getLogger(GfsClient.class);

    private final String master;
    private final PeerClient peers;

    public GfsClient(String master, Duration timeout) {
        this(master, new PeerClient(timeout));
    }

    public GfsClient(String master, PeerClient peers) {
        this.master = master;
        this.peers = peers;
    }

    public void createFile(String path) throws GfsException {
        peers.post(masterUrl(Protocol.CREATE, path)).orThrow();
    }

    public ChunkInfo allocateChunk(String path) throws GfsException {
        PeerResponse resp = peers.post(masterUrl(Protocol.ALLOCATE, path)).orThrow();
        try {
            return Json.chunk(resp.body());
        } catch (IOException e) {
            throw new GfsException(ErrorKind.TRANSPORT_FAILURE, "bad chunk record from master: " + e.getMessage(), e);
        }
    }

    public List<ChunkInfo> chunkLocations(String path) throws GfsException {
        PeerResponse resp = peers.get(masterUrl(Protocol.CHUNKS, path)).orThrow();
        try {
            return Json.chunkList(resp.body());
        } catch (IOException e) {
            throw new GfsException(ErrorKind.TRANSPORT_FAILURE, "bad chunk list from master: " + e.getMessage(), e);
        }
    }

    /**
     * Creates the file if needed, allocates one new chunk and pushes {@code data} to every replica.
     *
     * <p>Replica writes run concurrently and are best effort: a failed replica is logged and skipped,
     * and the call still returns normally once every replica has answered or failed. Only master
     * errors (other than the file already existing) are thrown.
     */
    public void writeFile(String path, byte[] data) throws GfsException {
        try {
            createFile(path);
        } catch (GfsException e) {
            if (e.kind() != ErrorKind.CONFLICT) throw e;
        }

        ChunkInfo chunk = allocateChunk(path);

        List<CompletableFuture<Boolean>> writes = new ArrayList<>(chunk.servers().size());
        for (String server : chunk.servers()) {
            String url = PeerClient.url(server, Protocol.WRITE, Protocol.PARAM_CHUNK, chunk.handle());
            writes.add(peers.postAsync(url, data).handle((resp, err) -> {
                if (err != null) {
                    log.warn("Failed to write to server {}: {}", server, err.getMessage());
                    return false;
                }
                if (!resp.ok()) {
                    log.warn("Failed to write to server {}: status {} {}", server, resp.status(), resp.text());
                    return false;
                }
                return true;
            }));
        }
        CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).join();

        long stored = writes.stream().filter(CompletableFuture::join).count();
        log.info("Wrote file {} ({} bytes, chunk {}, {}/{} replicas)",
                path, data.length, chunk.handle(), stored, chunk.servers().size());
    }

    public byte[] readFile(String path) throws GfsException {
        List<ChunkInfo> chunks = chunkLocations(path);
        if (chunks.isEmpty()) return new byte[0];

        ChunkInfo chunk = chunks.get(0);
        if (chunk.servers().isEmpty()) throw GfsException.unavailable("no servers available for chunk " + chunk.handle());

        String url = PeerClient.url(chunk.servers().get(0), Protocol.READ, Protocol.PARAM_CHUNK, chunk.handle());
        return peers.get(url).orThrow().body();
    }

    private String masterUrl(String path, String file) {
        return PeerClient.url(master, path, Protocol.PARAM_FILE, file);
    }
}
