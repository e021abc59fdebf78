package io.restspy.http.spi;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Fully buffered {@link HttpClientResponse} shared by the bundled adapters.
 *
 * <p>Header names are keyed case-insensitively. The JDK client reports them lowercased
 * while Apache and OkHttp keep the server's spelling, so callers must not depend on case.
 */
final class SimpleHttpClientResponse implements HttpClientResponse {
    private final int statusCode;
    private final Map<String, String> headers;
    private final byte[] body;

    SimpleHttpClientResponse(int statusCode, Map<String, String> headers, byte[] body) {
        Map<String, String> byName = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach(byName::putIfAbsent);
        this.statusCode = statusCode;
        this.headers = Collections.unmodifiableMap(byName);
        this.body = body == null ? new byte[0] : body;
    }

    @Override public int statusCode() { return statusCode; }

    @Override
    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    @Override public Map<String, String> headers() { return headers; }
    @Override public byte[] body() { return body; }
}
