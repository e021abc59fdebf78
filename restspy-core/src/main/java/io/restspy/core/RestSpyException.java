package io.restspy.core;

import java.time.Duration;

/**
 * Base class for REST Spy related exceptions.
 *
 * <p>Each subclass names one failure kind and carries the data that describes it,
 * so callers can discriminate with {@code catch} or {@code instanceof}.
 */
public abstract class RestSpyException extends RuntimeException {

    protected RestSpyException(String message) {
        super(message);
    }

    protected RestSpyException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a server is registered for a port that already has one.
     */
    public static class DuplicatePort extends RestSpyException {
        private final int port;

        public DuplicatePort(int port) {
            super("Server for port " + port + " is already registered");
            this.port = port;
        }

        public int port() {
            return port;
        }
    }

    /**
     * Raised when a local server does not become reachable within its readiness budget.
     */
    public static class Timeout extends RestSpyException {
        private final Duration timeout;

        public Timeout(String message, Duration timeout) {
            super(message);
            this.timeout = timeout;
        }

        public Duration timeout() {
            return timeout;
        }
    }

    /**
     * Raised when a server answers with a status the caller did not accept.
     */
    public static class HttpStatus extends RestSpyException {
        private final int status;

        public HttpStatus(int status) {
            super("Status Code (" + status + ") is not 200");
            this.status = status;
        }

        public HttpStatus(String message, int status) {
            super(message);
            this.status = status;
        }

        public int status() {
            return status;
        }
    }

    /**
     * Raised when a body cannot be decoded with its declared content encoding.
     */
    public static class ContentDecoding extends RestSpyException {
        private final String contentEncoding;

        public ContentDecoding(String contentEncoding, Throwable cause) {
            super("Failed to decode body with Content-Encoding '" + contentEncoding + "'", cause);
            this.contentEncoding = contentEncoding;
        }

        public String contentEncoding() {
            return contentEncoding;
        }
    }

    /**
     * Raised when the backing server process cannot be launched.
     */
    public static class ProcessFailure extends RestSpyException {
        public ProcessFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when an HTTP exchange fails for a reason other than the server not listening yet.
     */
    public static class Transport extends RestSpyException {
        public Transport(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a blocking lifecycle operation is interrupted.
     */
    public static class Interrupted extends RestSpyException {
        public Interrupted(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
