package uk.ac.ntu.gfs.common.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.gfs.common.error.GfsException;
import uk.ac.ntu.gfs.common.protocol.Json;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

public final class Exchanges {
    private static final Logger log = LoggerFactory.getLogger(Exchanges.class);

    private Exchanges() {}

    public static HttpHandler handle(GfsHandler handler) {
        return ex -> {
            try {
                handler.handle(ex);
            } catch (GfsException e) {
                replyError(ex, e);
            } catch (RuntimeException e) {
                log.error("Unhandled error on {} {}", ex.getRequestMethod(), ex.getRequestURI(), e);
                reply(ex, 500, "INTERNAL_ERROR " + e.getMessage());
            } finally {
                ex.close();
            }
        };
    }

    public static boolean requireMethod(HttpExchange ex, String method) throws IOException {
        if (method.equalsIgnoreCase(ex.getRequestMethod())) return true;
        reply(ex, 405, "METHOD_NOT_ALLOWED");
        return false;
    }

    public static String requireParam(HttpExchange ex, String key) throws GfsException {
        String v = queryParam(ex.getRequestURI().getRawQuery(), key);
        if (v == null || v.isEmpty()) throw GfsException.badRequest("MISSING " + key);
        return v;
    }

    public static String queryParam(String rawQuery, String key) {
        if (rawQuery == null) return null;
        for (String part : rawQuery.split("&")) {
            String[] kv = part.split("=", 2);
            if (kv.length == 2 && urlDecode(kv[0]).equals(key)) return urlDecode(kv[1]);
        }
        return null;
    }

    public static void reply(HttpExchange ex, int code, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        send(ex, code, "text/plain; charset=utf-8", bytes);
    }

    public static void replyBytes(HttpExchange ex, byte[] data) throws IOException {
        send(ex, 200, "application/octet-stream", data);
    }

    public static void replyJson(HttpExchange ex, Object value) throws IOException {
        send(ex, 200, "application/json", Json.toBytes(value));
    }

    public static void replyError(HttpExchange ex, GfsException e) throws IOException {
        reply(ex, e.kind().httpStatus(), e.kind() + " " + e.getMessage());
    }

    private static void send(HttpExchange ex, int code, String contentType, byte[] bytes) throws IOException {
        ex.getResponseHeaders().set("Content-Type", contentType);
        // -1: no body, HttpServer sends Content-Length: 0
        ex.sendResponseHeaders(code, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length == 0) return;
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static String urlDecode(String s) {
        try { return URLDecoder.decode(s, StandardCharsets.UTF_8); }
        catch (IllegalArgumentException e) { return s; }
    }
}
