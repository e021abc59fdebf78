package io.restspy.dispatch;

import java.util.Map;
import java.util.Objects;

/**
 * A request received by a mock server, reduced to what dispatch needs.
 *
 * @param method the HTTP method
 * @param path the request path, matched against registered patterns
 * @param query the raw query string without {@code ?}, or null
 * @param headers request headers, first value per name
 * @param body the request body, empty when there was none
 */
public record IncomingRequest(String method, String path, String query, Map<String, String> headers, byte[] body) {
    public IncomingRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        if (body == null) {
            body = new byte[0];
        }
    }

    public static IncomingRequest of(String method, String path) {
        return new IncomingRequest(method, path, null, Map.of(), null);
    }

    /**
     * Returns the path followed by {@code ?query} when a query string is present.
     */
    public String endpoint() {
        return query == null || query.isEmpty() ? path : path + "?" + query;
    }
}
