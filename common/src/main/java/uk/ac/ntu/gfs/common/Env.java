package uk.ac.ntu.gfs.common;

import java.util.Map;

public final class Env {
    private final Map<String, String> vars;

    public Env(Map<String, String> vars) {
        this.vars = vars;
    }

    public static Env system() {
        return new Env(System.getenv());
    }

    public String string(String key, String fallback) {
        String v = vars.get(key);
        if (v == null || v.isBlank()) return fallback;
        return v.trim();
    }

    public int integer(String key, int fallback) {
        String v = vars.get(key);
        if (v == null || v.isBlank()) return fallback;
        try { return Integer.parseInt(v.trim()); }
        catch (NumberFormatException e) { return fallback; }
    }

    public long longValue(String key, long fallback) {
        String v = vars.get(key);
        if (v == null || v.isBlank()) return fallback;
        try { return Long.parseLong(v.trim()); }
        catch (NumberFormatException e) { return fallback; }
    }
}
