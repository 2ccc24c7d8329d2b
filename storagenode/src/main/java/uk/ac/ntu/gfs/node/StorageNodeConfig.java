package uk.ac.ntu.gfs.node;

import uk.ac.ntu.gfs.common.Env;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

public record StorageNodeConfig(String host, int port, String masterAddress, Path dataRoot,
                                int registerAttempts, Duration registerDelay) {

    public static final int DEFAULT_REGISTER_ATTEMPTS = 5;
    public static final Duration DEFAULT_REGISTER_DELAY = Duration.ofSeconds(2);

    public static StorageNodeConfig fromEnv(Env env) {
        return new StorageNodeConfig(
                env.string("GFS_HOST", "localhost"),
                env.integer("GFS_PORT", 8081),
                env.string("GFS_MASTER", "localhost:8080"),
                Paths.get(env.string("GFS_DATA_ROOT", ".")),
                DEFAULT_REGISTER_ATTEMPTS,
                Duration.ofMillis(env.longValue("GFS_REGISTER_DELAY_MS", DEFAULT_REGISTER_DELAY.toMillis())));
    }

    public StorageNodeConfig withPort(int port) {
        return new StorageNodeConfig(host, port, masterAddress, dataRoot, registerAttempts, registerDelay);
    }

    public StorageNodeConfig withMaster(String masterAddress) {
        return new StorageNodeConfig(host, port, masterAddress, dataRoot, registerAttempts, registerDelay);
    }

    public StorageNodeConfig withDataRoot(Path dataRoot) {
        return new StorageNodeConfig(host, port, masterAddress, dataRoot, registerAttempts, registerDelay);
    }

    public static String dataDirName(String address) {
        return "chunkserver_" + address.replace(':', '_');
    }
}
