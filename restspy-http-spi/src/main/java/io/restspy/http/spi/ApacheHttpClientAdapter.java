package io.restspy.http.spi;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpClientAdapter} implementation using Apache HttpClient 5.
 *
 * <p>Requires {@code org.apache.httpcomponents.client5:httpclient5} on the classpath.
 */
public final class ApacheHttpClientAdapter implements HttpClientAdapter {

    private final CloseableHttpClient httpClient;

    public ApacheHttpClientAdapter(CloseableHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static ApacheHttpClientAdapter create() {
        return new ApacheHttpClientAdapter(HttpClients.custom().disableContentCompression().build());
    }

    public static ApacheHttpClientAdapter create(CloseableHttpClient httpClient) {
        return new ApacheHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        try {
            HttpUriRequestBase apacheRequest = toApacheRequest(request);
            return httpClient.execute(apacheRequest, response -> {
                byte[] body = response.getEntity() != null
                        ? EntityUtils.toByteArray(response.getEntity())
                        : null;
                return new SimpleHttpClientResponse(response.getCode(), firstValues(response.getHeaders()), body);
            });
        } catch (SocketTimeoutException e) {
            throw new HttpTimeoutException(e);
        } catch (ConnectException e) {
            throw new HttpConnectException(e);
        } catch (Exception e) {
            if (HttpConnectException.isConnectFailure(e)) throw new HttpConnectException(e);
            throw new HttpClientException(e);
        }
    }

    private static HttpUriRequestBase toApacheRequest(HttpClientRequest request) {
        URI uri = request.uri();
        String method = request.method();

        HttpUriRequestBase apacheRequest = new HttpUriRequestBase(method, uri);

        if (request.body() != null) {
            String contentType = request.contentType();
            ContentType type = contentType != null ? ContentType.parse(contentType) : ContentType.APPLICATION_OCTET_STREAM;
            apacheRequest.setEntity(new ByteArrayEntity(request.body(), type));
        }

        request.headers().forEach((name, value) -> {
            if (!name.equalsIgnoreCase(HttpClientRequest.CONTENT_TYPE)) apacheRequest.setHeader(name, value);
        });

        if (request.timeout() != null) {
            long millis = request.timeout().toMillis();
            RequestConfig config = RequestConfig.custom()
                    .setResponseTimeout(Timeout.of(millis, TimeUnit.MILLISECONDS))
                    .setConnectionRequestTimeout(Timeout.of(millis, TimeUnit.MILLISECONDS))
                    .build();
            apacheRequest.setConfig(config);
        }

        return apacheRequest;
    }

    private static Map<String, String> firstValues(Header[] headers) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Header h : headers) {
            out.putIfAbsent(h.getName(), h.getValue());
        }
        return out;
    }
}
