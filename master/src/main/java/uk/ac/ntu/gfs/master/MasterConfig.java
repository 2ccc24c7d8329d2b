package uk.ac.ntu.gfs.master;

import uk.ac.ntu.gfs.common.Env;
import uk.ac.ntu.gfs.common.protocol.Protocol;

import java.time.Duration;

// dbPath null: metadata in memory only
public record MasterConfig(int port, int replicationFactor, Duration leaseDuration, String dbPath) {

    public static final int DEFAULT_PORT = 8080;

    public static MasterConfig defaults(int port) {
        return new MasterConfig(port, Protocol.REPLICATION_FACTOR, Protocol.LEASE_DURATION, null);
    }

    public static MasterConfig fromEnv(Env env) {
        return new MasterConfig(
                env.integer("GFS_PORT", DEFAULT_PORT),
                env.integer("GFS_REPLICATION", Protocol.REPLICATION_FACTOR),
                Protocol.LEASE_DURATION,
                env.string("GFS_MASTER_DB", null));
    }

    public MasterConfig withPort(int port) {
        return new MasterConfig(port, replicationFactor, leaseDuration, dbPath);
    }

    public MasterConfig withDbPath(String dbPath) {
        return new MasterConfig(port, replicationFactor, leaseDuration, dbPath);
    }
}
