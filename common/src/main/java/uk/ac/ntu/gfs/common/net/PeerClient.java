package uk.ac.ntu.gfs.common.net;

import uk.ac.ntu.gfs.common.error.ErrorKind;
import uk.ac.ntu.gfs.common.error.GfsException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static java.net.http.HttpRequest.BodyPublishers;
import static java.net.http.HttpResponse.BodyHandlers;

public final class PeerClient {
    private final HttpClient client;
    private final Duration timeout;

    public PeerClient(Duration timeout) {
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(3))
                .build();
    }

    public static String url(String address, String path, String param, String value) {
        return "http://" + address + path + "?" + param + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    public PeerResponse get(String url) throws GfsException {
        return send(request(url, "GET").GET().build());
    }

    public PeerResponse post(String url) throws GfsException {
        return send(request(url, "POST").POST(BodyPublishers.noBody()).build());
    }

    public PeerResponse post(String url, byte[] body) throws GfsException {
        return send(request(url, "POST").POST(BodyPublishers.ofByteArray(body)).build());
    }

    public CompletableFuture<PeerResponse> postAsync(String url, byte[] body) {
        HttpRequest req;
        try {
            req = request(url).POST(BodyPublishers.ofByteArray(body)).build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        return client.sendAsync(req, BodyHandlers.ofByteArray())
                .thenApply(resp -> new PeerResponse(resp.statusCode(), resp.body()));
    }

    private HttpRequest.Builder request(String url) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout);
    }

    private HttpRequest.Builder request(String url, String method) throws GfsException {
        try {
            return request(url);
        } catch (IllegalArgumentException e) {
            throw new GfsException(ErrorKind.TRANSPORT_FAILURE, method + " " + url + ": " + e.getMessage(), e);
        }
    }

    private PeerResponse send(HttpRequest req) throws GfsException {
        try {
            HttpResponse<byte[]> resp = client.send(req, BodyHandlers.ofByteArray());
            return new PeerResponse(resp.statusCode(), resp.body());
        } catch (IOException e) {
            throw new GfsException(ErrorKind.TRANSPORT_FAILURE, req.uri() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GfsException(ErrorKind.TRANSPORT_FAILURE, req.uri() + ": interrupted", e);
        }
    }
}
