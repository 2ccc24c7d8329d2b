package uk.ac.ntu.gfs.common;

public final class Version {
    private Version() {}

    public static final String NAME = "minigfs";
    public static final String VERSION = "1.0.0";
}
