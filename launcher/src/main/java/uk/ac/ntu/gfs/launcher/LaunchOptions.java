package uk.ac.ntu.gfs.launcher;

import uk.ac.ntu.gfs.common.Env;

import java.util.HashMap;
import java.util.Map;

public final class LaunchOptions {
    private final Map<String, String> flags;
    private final Env env;

    private LaunchOptions(Map<String, String> flags, Env env) {
        this.flags = flags;
        this.env = env;
    }

    public static LaunchOptions parse(String[] args, Env env) {
        Map<String, String> flags = new HashMap<>();
        for (String arg : args) {
            String a = arg.startsWith("--") ? arg.substring(2) : arg.startsWith("-") ? arg.substring(1) : null;
            if (a == null) throw new IllegalArgumentException("Unexpected argument: " + arg);

            String[] kv = a.split("=", 2);
            if (kv.length != 2 || kv[0].isBlank()) throw new IllegalArgumentException("Expected -name=value, got: " + arg);
            flags.put(kv[0].trim(), kv[1]);
        }
        return new LaunchOptions(flags, env);
    }

    public Mode mode() {
        return Mode.parse(string("mode", "GFS_MODE", "master"));
    }

    public String string(String flag, String envKey, String fallback) {
        String v = flags.get(flag);
        if (v != null) return v;
        return envKey == null ? fallback : env.string(envKey, fallback);
    }

    public int integer(String flag, String envKey, int fallback) {
        String v = flags.get(flag);
        if (v == null) return envKey == null ? fallback : env.integer(envKey, fallback);
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Flag -" + flag + " must be a number, got: " + v);
        }
    }

    public Env env() {
        return env;
    }
}
