package io.restspy.core;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;

/**
 * A canned response served for every request whose path matches {@link #pattern()}.
 */
public final class ResponseDouble extends Matchable {

    public static final int DEFAULT_STATUS_CODE = 200;

    private final int statusCode;
    private final Map<String, String> headers;
    private final byte[] body;

    public ResponseDouble(String pattern, int statusCode, Map<String, String> headers, byte[] body) {
        this(UUID.randomUUID().toString(), pattern, statusCode, headers, body);
    }

    /**
     * Recreates a double whose id was assigned elsewhere, e.g. by the client that defined it.
     */
    public ResponseDouble(String id, String pattern, int statusCode, Map<String, String> headers, byte[] body) {
        super(id, pattern);
        this.statusCode = statusCode;
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.body = body == null ? new byte[0] : body.clone();
    }

    public ResponseDouble(String pattern, int statusCode, Map<String, String> headers, String body) {
        this(pattern, statusCode, headers, body == null ? null : body.getBytes(StandardCharsets.UTF_8));
    }

    public ResponseDouble(String pattern, String body) {
        this(pattern, DEFAULT_STATUS_CODE, Map.of(), body);
    }

    public int statusCode() {
        return statusCode;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public byte[] body() {
        return body.clone();
    }
}
