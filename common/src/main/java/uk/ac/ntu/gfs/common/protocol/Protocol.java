package uk.ac.ntu.gfs.common.protocol;

import java.time.Duration;

public final class Protocol {
    private Protocol() {}

    public static final int REPLICATION_FACTOR = 3;
    // unused: one write is one chunk
    public static final long CHUNK_SIZE = 64L * 1024 * 1024;
    public static final Duration LEASE_DURATION = Duration.ofSeconds(60);

    // master
    public static final String REGISTER = "/register";
    public static final String CREATE = "/create";
    public static final String CHUNKS = "/chunks";
    public static final String ALLOCATE = "/allocate";

    // storage node
    public static final String WRITE = "/write";
    public static final String READ = "/read";

    public static final String HEALTH = "/health";
    public static final String VERSION = "/version";

    public static final String PARAM_SERVER = "server";
    public static final String PARAM_FILE = "file";
    public static final String PARAM_CHUNK = "chunk";
}
