package io.restspy.server;

import io.restspy.core.Headers;
import io.restspy.core.RestSpyException;
import io.restspy.http.spi.HttpClientAdapter;
import io.restspy.http.spi.HttpClientException;
import io.restspy.http.spi.HttpClientRequest;
import io.restspy.http.spi.HttpClientResponse;

import java.net.URI;
import java.util.Objects;

/**
 * HTTP verbs shared by every {@link Server}, resolved against the base URL.
 */
public abstract class AbstractServer implements Server {

    private final URI baseUrl;
    private final HttpClientAdapter httpClient;

    protected AbstractServer(URI baseUrl, HttpClientAdapter httpClient) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public URI baseUrl() {
        return baseUrl;
    }

    protected HttpClientAdapter httpClient() {
        return httpClient;
    }

    @Override
    public byte[] get(String endpoint) throws HttpClientException {
        HttpClientResponse response = httpClient.send(HttpClientRequest.get(fullUrl(endpoint)).build());
        if (response.statusCode() != 200) {
            throw new RestSpyException.HttpStatus(response.statusCode());
        }
        return response.body();
    }

    @Override
    public HttpClientResponse post(String endpoint, byte[] data, String contentType) throws HttpClientException {
        HttpClientRequest.Builder request = HttpClientRequest.post(fullUrl(endpoint)).body(data);
        if (contentType != null) {
            request.header(Headers.CONTENT_TYPE, contentType);
        }
        return httpClient.send(request.build());
    }

    @Override
    public HttpClientResponse delete(String endpoint) throws HttpClientException {
        return httpClient.send(HttpClientRequest.delete(fullUrl(endpoint)).build());
    }

    protected URI fullUrl(String endpoint) {
        return baseUrl.resolve(endpoint);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + baseUrl + "}";
    }
}
