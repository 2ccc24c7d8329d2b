package uk.ac.ntu.gfs.launcher;

import uk.ac.ntu.gfs.client.GfsClient;
import uk.ac.ntu.gfs.common.Env;
import uk.ac.ntu.gfs.common.error.GfsException;
import uk.ac.ntu.gfs.master.MasterConfig;
import uk.ac.ntu.gfs.master.MasterServer;
import uk.ac.ntu.gfs.node.StorageNodeConfig;
import uk.ac.ntu.gfs.node.StorageNodeServer;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Single entry point. Usage:
 * <pre>
 *   -mode=master        [-port=8080] [-db=meta.db]
 *   -mode=storageserver [-port=8081] [-master=localhost:8080] [-host=localhost] [-dataRoot=.]
 *   -mode=client        [-master=localhost:8080] -operation=write -file=/a.txt -data="hello"
 *   -mode=client        [-master=localhost:8080] -operation=read  -file=/a.txt
 * </pre>
 * Server modes return once listening; their threads keep the JVM alive.
 */
public final class GfsMain {
    private GfsMain() {}

    public static void main(String[] args) {
        int code = run(args, Env.system(), System.out, System.err);
        if (code != 0) System.exit(code);
    }

    static int run(String[] args, Env env, PrintStream out, PrintStream err) {
        LaunchOptions opts;
        Mode mode;
        try {
            opts = LaunchOptions.parse(args, env);
            mode = opts.mode();
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return 1;
        }

        try {
            switch (mode) {
                case MASTER -> startMaster(opts);
                case STORAGE_SERVER -> startStorageServer(opts);
                case CLIENT -> {
                    return runClient(opts, out, err);
                }
            }
            return 0;
        } catch (IOException e) {
            err.println("Failed to start " + mode + ": " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return 1;
        }
    }

    static MasterServer startMaster(LaunchOptions opts) throws IOException {
        MasterConfig config = MasterConfig.fromEnv(opts.env())
                .withPort(opts.integer("port", "GFS_PORT", MasterConfig.DEFAULT_PORT))
                .withDbPath(opts.string("db", "GFS_MASTER_DB", null));
        return MasterServer.start(config);
    }

    static StorageNodeServer startStorageServer(LaunchOptions opts) throws IOException {
        StorageNodeConfig base = StorageNodeConfig.fromEnv(opts.env());
        StorageNodeConfig config = new StorageNodeConfig(
                opts.string("host", "GFS_HOST", base.host()),
                opts.integer("port", "GFS_PORT", base.port()),
                opts.string("master", "GFS_MASTER", base.masterAddress()),
                Paths.get(opts.string("dataRoot", "GFS_DATA_ROOT", base.dataRoot().toString())),
                base.registerAttempts(),
                base.registerDelay());
        return StorageNodeServer.start(config);
    }

    static int runClient(LaunchOptions opts, PrintStream out, PrintStream err) {
        String master = opts.string("master", "GFS_MASTER", "localhost:8080");
        int timeout = opts.integer("timeout", "GFS_CLIENT_TIMEOUT_SECONDS", 30);
        GfsClient client = new GfsClient(master, Duration.ofSeconds(timeout));

        String operation = opts.string("operation", null, "read");
        String file = opts.string("file", null, "");
        String data = opts.string("data", null, "");

        switch (operation) {
            case "write" -> {
                if (file.isEmpty() || data.isEmpty()) {
                    err.println("File and data required for write operation");
                    return 1;
                }
                try {
                    client.writeFile(file, data.getBytes(StandardCharsets.UTF_8));
                } catch (GfsException e) {
                    err.println("Write failed: " + e.kind() + " " + e.getMessage());
                    return 1;
                }
                out.println("Successfully wrote to " + file);
                return 0;
            }
            case "read" -> {
                if (file.isEmpty()) {
                    err.println("File required for read operation");
                    return 1;
                }
                try {
                    byte[] content = client.readFile(file);
                    out.println("Content of " + file + ": " + new String(content, StandardCharsets.UTF_8));
                    return 0;
                } catch (GfsException e) {
                    err.println("Read failed: " + e.kind() + " " + e.getMessage());
                    return 1;
                }
            }
            default -> {
                err.println("Unknown operation. Use 'read' or 'write'");
                return 1;
            }
        }
    }
}
