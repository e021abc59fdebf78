package io.restspy.http.spi;

/**
 * Abstraction for HTTP client implementations.
 *
 * <p>Servers, the control client and the proxying dispatcher talk HTTP only through
 * this interface, so REST Spy can run on the JDK HttpClient, Apache HttpClient or OkHttp
 * without depending on any of them directly.
 *
 * <p>Implementations should be thread-safe and reusable.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter adapter = JdkHttpClientAdapter.create();
 * HttpClientRequest request = HttpClientRequest.get(URI.create("http://localhost:1234/")).build();
 * HttpClientResponse response = adapter.send(request);
 * }</pre>
 */
public interface HttpClientAdapter {

    /**
     * Sends an HTTP request and reads the whole response body into memory.
     *
     * @param request the HTTP request to send
     * @return the HTTP response
     * @throws HttpConnectException if no connection to the target could be established
     * @throws HttpTimeoutException if the request times out
     * @throws HttpClientException if the request fails for any other reason
     */
    HttpClientResponse send(HttpClientRequest request) throws HttpClientException;
}
