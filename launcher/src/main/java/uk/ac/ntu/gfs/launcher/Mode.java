package uk.ac.ntu.gfs.launcher;

import java.util.Locale;

public enum Mode {
    MASTER,
    STORAGE_SERVER,
    CLIENT;

    public static Mode parse(String raw) {
        if (raw == null) throw new IllegalArgumentException("Mode required. Use 'master', 'storageserver', or 'client'");
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "master" -> MASTER;
            case "storageserver", "chunkserver" -> STORAGE_SERVER;
            case "client" -> CLIENT;
            default -> throw new IllegalArgumentException(
                    "Unknown mode '" + raw + "'. Use 'master', 'storageserver', or 'client'");
        };
    }
}
