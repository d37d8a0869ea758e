package com.talentscout.data.http;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Non-2xx response from an upstream API. Carries enough of the response to classify it.
 */
public class HttpStatusException extends RuntimeException {
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;

    public HttpStatusException(String message, int statusCode, Map<String, List<String>> headers, String body) {
        super(message);
        this.statusCode = statusCode;
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.body = body == null ? "" : body;
    }

    public int statusCode() {
        return statusCode;
    }

    public String body() {
        return body;
    }

    public String header(String name) {
        if (name == null) {
            return "";
        }
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty()) {
                return e.getValue().get(0);
            }
        }
        return "";
    }

    /**
     * 429 always; 403 only when the platform says the quota is gone.
     */
    public boolean isRateLimited() {
        if (statusCode == 429) {
            return true;
        }
        if (statusCode != 403) {
            return false;
        }
        if ("0".equals(header("X-RateLimit-Remaining").trim())) {
            return true;
        }
        String lower = body.toLowerCase(Locale.ROOT);
        return lower.contains("rate limit")
                || lower.contains("ratelimitexceeded")
                || lower.contains("dailylimitexceeded")
                || lower.contains("quota");
    }
}
