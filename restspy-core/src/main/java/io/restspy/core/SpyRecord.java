package io.restspy.core;

import java.util.Map;

/**
 * One request observed by a server, together with the representation of the response it got.
 *
 * @param method the HTTP method
 * @param endpoint the request path, including the query string if there was one
 * @param body the request body as text, empty when there was none
 * @param response the {@link Response#toRepresentation()} of the answer
 */
public record SpyRecord(String method, String endpoint, String body, Map<String, Object> response) {
    public SpyRecord {
        if (body == null) {
            body = "";
        }
        response = response == null ? Map.of() : Map.copyOf(response);
    }
}
