package io.restspy.http.spi;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * An HTTP request for an {@link HttpClientAdapter}: control calls against a mock server,
 * readiness probes, and requests a proxy route forwards upstream.
 *
 * <p>Header names are keyed case-insensitively; setting a header twice keeps the last value.
 * The body is copied when the request is built.
 */
public final class HttpClientRequest {

    static final String CONTENT_TYPE = "Content-Type";

    private final String method;
    private final URI uri;
    private final Map<String, String> headers;
    private final byte[] body;
    private final Duration timeout;

    private HttpClientRequest(Builder builder) {
        this.method = builder.method;
        this.uri = builder.uri;
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(builder.headers);
        this.headers = Collections.unmodifiableMap(copy);
        this.body = builder.body == null ? null : builder.body.clone();
        this.timeout = builder.timeout;
    }

    public String method() { return method; }
    public URI uri() { return uri; }
    public Map<String, String> headers() { return headers; }

    /**
     * Returns the body, or null for a request without one.
     */
    public byte[] body() { return body; }

    /**
     * Returns the per-request timeout, or null to use the client's default.
     */
    public Duration timeout() { return timeout; }

    /**
     * Returns the {@code Content-Type} header, or null when none was set.
     */
    public String contentType() {
        return headers.get(CONTENT_TYPE);
    }

    /**
     * Starts a request with an arbitrary method, as received by a proxy route.
     * The method name is upper-cased.
     */
    public static Builder request(String method, URI uri) {
        return new Builder(method, uri);
    }

    public static Builder get(URI uri) { return new Builder("GET", uri); }
    public static Builder post(URI uri) { return new Builder("POST", uri); }
    public static Builder delete(URI uri) { return new Builder("DELETE", uri); }

    public static final class Builder {
        private final String method;
        private final URI uri;
        private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private byte[] body;
        private Duration timeout;

        private Builder(String method, URI uri) {
            this.method = Objects.requireNonNull(method, "method").toUpperCase(Locale.ROOT);
            this.uri = Objects.requireNonNull(uri, "uri");
        }

        public Builder header(String name, String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            headers.forEach(this::header);
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public HttpClientRequest build() {
            return new HttpClientRequest(this);
        }
    }
}
