package io.restspy.server;

import io.restspy.http.spi.HttpClientAdapter;
import io.restspy.http.spi.HttpClientException;
import io.restspy.http.spi.JdkHttpClientAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;

/**
 * A mock server whose process is managed outside this library, typically one shared
 * instance used by several test runs.
 *
 * <p>{@link #start()} does nothing. {@link #stop()} leaves the process alone and only
 * clears the doubles and the spy log so the next test starts clean.
 */
public final class ExternalServer extends AbstractServer {

    private static final Logger log = LoggerFactory.getLogger(ExternalServer.class);

    static final String DOUBLES_ENDPOINT = "/doubles";
    static final String SPY_ENDPOINT = "/spy";

    public ExternalServer(URI baseUrl) {
        this(baseUrl, JdkHttpClientAdapter.create());
    }

    public ExternalServer(URI baseUrl, HttpClientAdapter httpClient) {
        super(baseUrl, httpClient);
    }

    @Override
    public void start() {
        // lifecycle is owned by whoever runs the server
    }

    @Override
    public void stop() {
        cleanUp(DOUBLES_ENDPOINT);
        cleanUp(SPY_ENDPOINT);
    }

    private void cleanUp(String endpoint) {
        try {
            delete(endpoint);
        } catch (HttpClientException | RuntimeException e) {
            log.warn("Cleanup call DELETE {} on {} failed", endpoint, baseUrl(), e);
        }
    }
}
