package com.talentscout.data.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Thin wrapper over {@link HttpClient} used by every collector.
 * Non-2xx answers raise {@link HttpStatusException}; the URL in the message has credentials masked.
 */
public class HttpClientEx {
    private static final String USER_AGENT = "TalentScout/1.0";

    private final HttpClient client;

    public HttpClientEx() {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public String getText(String url, Duration timeout, Map<String, String> headers)
            throws IOException, InterruptedException {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .GET()
                .header("User-Agent", USER_AGENT);
        applyHeaders(req, headers);
        return send(req.build(), url);
    }

    public String postJson(String url, String json, Duration timeout, Map<String, String> headers)
            throws IOException, InterruptedException {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(json == null ? "" : json))
                .header("Content-Type", "application/json")
                .header("User-Agent", USER_AGENT);
        applyHeaders(req, headers);
        return send(req.build(), url);
    }

    /**
     * Replaces values of credential-looking query parameters so URLs can be logged.
     */
    public static String maskUrl(String url) {
        if (url == null) {
            return "";
        }
        return url.replaceAll("(?i)([?&](key|token|access_token|api_key)=)[^&]*", "$1***");
    }

    private String send(HttpRequest request, String url) throws IOException, InterruptedException {
        HttpResponse<String> resp = client.send(request, HttpResponse.BodyHandlers.ofString());
        int status = resp.statusCode();
        if (status >= 200 && status < 300) {
            return resp.body();
        }
        throw new HttpStatusException(
                "HTTP " + status + " for " + maskUrl(url),
                status,
                resp.headers().map(),
                resp.body()
        );
    }

    private static void applyHeaders(HttpRequest.Builder req, Map<String, String> headers) {
        if (headers == null) {
            return;
        }
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey() != null && e.getValue() != null && !e.getValue().isBlank()) {
                req.header(e.getKey(), e.getValue());
            }
        }
    }
}
