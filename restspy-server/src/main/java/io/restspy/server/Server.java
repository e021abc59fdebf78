package io.restspy.server;

import io.restspy.http.spi.HttpClientException;
import io.restspy.http.spi.HttpClientResponse;

import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * A mock HTTP server that tests can start, stop and talk to.
 */
public interface Server {

    URI baseUrl();

    void start();

    void stop();

    /**
     * Fetches {@code endpoint} and returns the body.
     *
     * @throws io.restspy.core.RestSpyException.HttpStatus unless the status is exactly 200
     * @throws HttpClientException if the request could not be performed
     */
    byte[] get(String endpoint) throws HttpClientException;

    /**
     * Posts {@code data} to {@code endpoint}. The status is not checked.
     */
    HttpClientResponse post(String endpoint, byte[] data, String contentType) throws HttpClientException;

    default HttpClientResponse post(String endpoint, String data) throws HttpClientException {
        return post(endpoint, data.getBytes(StandardCharsets.UTF_8), "text/plain; charset=UTF-8");
    }

    /**
     * Deletes {@code endpoint}. The status is not checked.
     */
    HttpClientResponse delete(String endpoint) throws HttpClientException;
}
