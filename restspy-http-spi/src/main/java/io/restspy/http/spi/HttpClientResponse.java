package io.restspy.http.spi;

import java.util.Map;
import java.util.Optional;

/**
 * Represents an HTTP response from an {@link HttpClientAdapter}.
 */
public interface HttpClientResponse {

    /**
     * Returns the HTTP status code.
     * @return the status code (e.g., 200, 404, 500)
     */
    int statusCode();

    /**
     * Returns the first value for the specified header name.
     * @param name the header name (case-insensitive)
     * @return the header value, or empty if not present
     */
    Optional<String> header(String name);

    /**
     * Returns every header with its first value. Lookups on the returned map ignore the
     * case of the header name.
     * @return the headers, never null
     */
    Map<String, String> headers();

    /**
     * Returns the response body.
     * @return the body bytes, empty if the response had none
     */
    byte[] body();
}
