package io.restspy.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of serving one request, whether it was proxied, answered by a double or not found.
 *
 * <p>The decoded body is computed once, during construction, from the
 * {@code Content-Encoding} header. Instances are immutable.
 */
public final class Response {

    private static final Logger log = LoggerFactory.getLogger(Response.class);

    public static final int NOT_FOUND_STATUS = 404;

    /**
     * Where a response came from. {@link #wireName()} is the {@code type} in
     * {@link #toRepresentation()}.
     */
    public enum Kind {
        PROXY("proxy"),
        DOUBLE("double"),
        NOT_FOUND("not_found");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    private final Kind kind;
    private final int statusCode;
    private final Map<String, String> headers;
    private final byte[] body;
    private final byte[] decodedBody;

    private Response(Kind kind, int statusCode, Map<String, String> headers, byte[] body, ContentDecoder decoder) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.statusCode = statusCode;
        this.headers = headers == null ? null : Map.copyOf(headers);
        this.body = body == null ? new byte[0] : body.clone();
        this.decodedBody = this.headers == null || this.headers.isEmpty()
                ? this.body
                : decoder.decode(this.body, Headers.firstValue(this.headers, Headers.CONTENT_ENCODING).orElse(null));
    }

    public static Response proxy(int statusCode, Map<String, String> headers, byte[] body) {
        return proxy(statusCode, headers, body, ContentDecoders.standard());
    }

    public static Response proxy(int statusCode, Map<String, String> headers, byte[] body, ContentDecoder decoder) {
        return new Response(Kind.PROXY, statusCode, headers, body, decoder);
    }

    public static Response fromDouble(ResponseDouble responseDouble) {
        return fromDouble(responseDouble, ContentDecoders.standard());
    }

    public static Response fromDouble(ResponseDouble responseDouble, ContentDecoder decoder) {
        return new Response(Kind.DOUBLE, responseDouble.statusCode(), responseDouble.headers(),
                responseDouble.body(), decoder);
    }

    public static Response notFound() {
        return new Response(Kind.NOT_FOUND, NOT_FOUND_STATUS, Map.of(), new byte[0], ContentDecoders.identity());
    }

    public Kind kind() {
        return kind;
    }

    public int statusCode() {
        return statusCode;
    }

    /**
     * Returns the headers, empty when the response was built without any.
     */
    public Map<String, String> headers() {
        return headers == null ? Map.of() : headers;
    }

    public byte[] body() {
        return body.clone();
    }

    public byte[] decodedBody() {
        return decodedBody.clone();
    }

    public String decodedBodyAsString() {
        return new String(decodedBody, StandardCharsets.UTF_8);
    }

    /**
     * Serializable view: {@code {"type", "status_code", "body"}} with the decoded body as text.
     */
    public Map<String, Object> toRepresentation() {
        String text = decodedBodyAsString();
        log.debug("Representing {} response, status={}, body={}", kind.wireName(), statusCode, text);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", kind.wireName());
        out.put("status_code", statusCode);
        out.put("body", text);
        return out;
    }

    @Override
    public String toString() {
        return "Response{kind=" + kind.wireName() + ", statusCode=" + statusCode + "}";
    }
}
