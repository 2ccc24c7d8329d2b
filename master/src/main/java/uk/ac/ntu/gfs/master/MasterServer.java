package uk.ac.ntu.gfs.master;

import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.gfs.common.Version;
import uk.ac.ntu.gfs.common.protocol.Protocol;
import uk.ac.ntu.gfs.master.core.Master;
import uk.ac.ntu.gfs.master.core.MetadataJournal;
import uk.ac.ntu.gfs.master.core.PrefixPlacement;
import uk.ac.ntu.gfs.master.db.SqliteJournal;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.sql.SQLException;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static uk.ac.ntu.gfs.common.http.Exchanges.handle;
import static uk.ac.ntu.gfs.common.http.Exchanges.reply;
import static uk.ac.ntu.gfs.common.http.Exchanges.replyJson;
import static uk.ac.ntu.gfs.common.http.Exchanges.requireMethod;
import static uk.ac.ntu.gfs.common.http.Exchanges.requireParam;

public final class MasterServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MasterServer.class);

    private final Master master;
    private final HttpServer server;
    private final ExecutorService executor;

    private MasterServer(Master master, HttpServer server, ExecutorService executor) {
        this.master = master;
        this.server = server;
        this.executor = executor;
    }

    public static MasterServer start(MasterConfig config) throws IOException {
        MetadataJournal journal;
        if (config.dbPath() == null) {
            journal = MetadataJournal.none();
        } else {
            try {
                journal = SqliteJournal.open(config.dbPath());
            } catch (SQLException e) {
                throw new IOException("Cannot open metadata journal " + config.dbPath(), e);
            }
        }
        Master master;
        try {
            master = new Master(new PrefixPlacement(), config.replicationFactor(),
                    config.leaseDuration(), Clock.systemUTC(), journal);
        } catch (IllegalStateException e) {
            throw new IOException("Cannot restore metadata from " + config.dbPath() + ": " + e.getMessage(), e);
        }
        return start(master, config.port());
    }

    public static MasterServer start(Master master, int port) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext(Protocol.HEALTH, handle(ex ->
                reply(ex, 200, "OK servers=" + master.registeredServers().size())));
        server.createContext(Protocol.VERSION, handle(ex -> reply(ex, 200, Version.NAME + " " + Version.VERSION)));

        server.createContext(Protocol.REGISTER, handle(ex -> {
            if (!requireMethod(ex, "POST")) return;
            master.registerServer(requireParam(ex, Protocol.PARAM_SERVER));
            reply(ex, 200, "OK");
        }));

        server.createContext(Protocol.CREATE, handle(ex -> {
            if (!requireMethod(ex, "POST")) return;
            master.createFile(requireParam(ex, Protocol.PARAM_FILE));
            reply(ex, 200, "OK");
        }));

        server.createContext(Protocol.CHUNKS, handle(ex ->
                replyJson(ex, master.chunkLocations(requireParam(ex, Protocol.PARAM_FILE)))));

        server.createContext(Protocol.ALLOCATE, handle(ex -> {
            if (!requireMethod(ex, "POST")) return;
            replyJson(ex, master.allocateChunk(requireParam(ex, Protocol.PARAM_FILE)));
        }));

        // one thread per in-flight request, no queueing
        ExecutorService executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();

        log.info("Master started on port {} (placement={}, replication={})",
                server.getAddress().getPort(), master.placementName(), master.replicationFactor());
        return new MasterServer(master, server, executor);
    }

    public int port() {
        return server.getAddress().getPort();
    }

    public Master master() {
        return master;
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
