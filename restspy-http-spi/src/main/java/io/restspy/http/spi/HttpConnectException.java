package io.restspy.http.spi;

import java.net.ConnectException;

/**
 * Exception thrown when the target refused the connection or could not be reached.
 *
 * <p>A server that is still booting shows up this way, so lifecycle code treats it as
 * "not ready yet" rather than as a failure.
 */
public class HttpConnectException extends HttpClientException {

    public HttpConnectException(Throwable cause) {
        super(cause);
    }

    /**
     * Returns true if {@code error} or one of its causes is a {@link ConnectException}.
     */
    static boolean isConnectFailure(Throwable error) {
        Throwable cause = error;
        while (cause != null) {
            if (cause instanceof ConnectException) return true;
            cause = cause.getCause();
        }
        return false;
    }
}
