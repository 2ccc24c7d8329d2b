package uk.ac.ntu.gfs.node;

import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.gfs.common.Version;
import uk.ac.ntu.gfs.common.net.PeerClient;
import uk.ac.ntu.gfs.common.protocol.Protocol;
import uk.ac.ntu.gfs.node.store.ChunkStore;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static uk.ac.ntu.gfs.common.http.Exchanges.handle;
import static uk.ac.ntu.gfs.common.http.Exchanges.reply;
import static uk.ac.ntu.gfs.common.http.Exchanges.replyBytes;
import static uk.ac.ntu.gfs.common.http.Exchanges.requireMethod;
import static uk.ac.ntu.gfs.common.http.Exchanges.requireParam;

public final class StorageNodeServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StorageNodeServer.class);

    private final String address;
    private final ChunkStore store;
    private final HttpServer server;
    private final ExecutorService executor;
    private final boolean registered;

    private StorageNodeServer(String address, ChunkStore store, HttpServer server,
                              ExecutorService executor, boolean registered) {
        this.address = address;
        this.store = store;
        this.server = server;
        this.executor = executor;
        this.registered = registered;
    }

    public static StorageNodeServer start(StorageNodeConfig config) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(config.port()), 0);
        String address = config.host() + ":" + server.getAddress().getPort();

        ChunkStore store = new ChunkStore(config.dataRoot().resolve(StorageNodeConfig.dataDirName(address)));

        server.createContext(Protocol.HEALTH, handle(ex -> reply(ex, 200, "OK")));
        server.createContext(Protocol.VERSION, handle(ex -> reply(ex, 200, Version.NAME + " " + Version.VERSION)));

        server.createContext(Protocol.WRITE, handle(ex -> {
            if (!requireMethod(ex, "POST")) return;
            String handle = requireParam(ex, Protocol.PARAM_CHUNK);
            byte[] data = ex.getRequestBody().readAllBytes();
            store.store(handle, data);
            log.info("Stored chunk {} ({} bytes) on {}", handle, data.length, address);
            reply(ex, 200, "OK");
        }));

        server.createContext(Protocol.READ, handle(ex ->
                replyBytes(ex, store.retrieve(requireParam(ex, Protocol.PARAM_CHUNK)))));

        ExecutorService executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();

        log.info("Chunkserver started on {} (data dir: {})", address, store.baseDir().toAbsolutePath());

        MasterRegistration registration = new MasterRegistration(new PeerClient(Duration.ofSeconds(5)),
                config.masterAddress(), config.registerAttempts(), config.registerDelay());
        boolean registered = registration.register(address);

        return new StorageNodeServer(address, store, server, executor, registered);
    }

    public String address() {
        return address;
    }

    public int port() {
        return server.getAddress().getPort();
    }

    public ChunkStore store() {
        return store;
    }

    public boolean registered() {
        return registered;
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
