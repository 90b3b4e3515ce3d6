package org.iceforge.freeagent.client;

import org.springframework.http.HttpMethod;

/**
 * A FreeAgent request that failed, either with a non-2xx response or before a response arrived.
 * Transport failures carry status {@code 0}.
 */
public class FreeAgentApiException extends RuntimeException {
    private final HttpMethod method;
    private final String path;
    private final int status;
    private final String responseBody;

    public FreeAgentApiException(HttpMethod method, String path, int status, String responseBody) {
        super("FreeAgent " + method + " " + path + " failed with HTTP " + status + bodySuffix(responseBody));
        this.method = method;
        this.path = path;
        this.status = status;
        this.responseBody = responseBody == null ? "" : responseBody;
    }

    public FreeAgentApiException(HttpMethod method, String path, String message, Throwable cause) {
        super("FreeAgent " + method + " " + path + " failed: " + message, cause);
        this.method = method;
        this.path = path;
        this.status = 0;
        this.responseBody = "";
    }

    public HttpMethod method() { return method; }
    public String path() { return path; }
    public int status() { return status; }
    public String responseBody() { return responseBody; }

    public boolean isNotFound() {
        return status == 404;
    }

    private static String bodySuffix(String body) {
        if (body == null || body.isBlank()) return "";
        String trimmed = body.strip();
        return ": " + (trimmed.length() > 500 ? trimmed.substring(0, 500) + "..." : trimmed);
    }
}
