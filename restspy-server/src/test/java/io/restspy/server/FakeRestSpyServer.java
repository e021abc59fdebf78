package io.restspy.server;

import io.restspy.core.MatchableRegistry;
import io.restspy.core.ProxyRoute;
import io.restspy.core.Response;
import io.restspy.core.ResponseDouble;
import io.restspy.dispatch.IncomingRequest;
import io.restspy.dispatch.RequestDispatcher;
import io.restspy.dispatch.SpyLog;
import io.restspy.http.spi.JdkHttpClientAdapter;
import io.restspy.json.jackson.JacksonJsonCodec;
import io.restspy.json.spi.JsonException;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;

import java.io.IOException;
import java.net.InetAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-process stand-in for the rest-spy binary: control endpoints plus request dispatch,
 * served by a {@link MockWebServer}.
 */
final class FakeRestSpyServer extends Dispatcher {

    private final MatchableRegistry<ResponseDouble> doubles = new MatchableRegistry<>();
    private final MatchableRegistry<ProxyRoute> proxies = new MatchableRegistry<>();
    private final SpyLog spyLog = new SpyLog();
    private final RequestDispatcher dispatcher =
            new RequestDispatcher(doubles, proxies, spyLog, JdkHttpClientAdapter.create());
    private final JacksonJsonCodec codec = new JacksonJsonCodec();
    private final MockWebServer server = new MockWebServer();

    FakeRestSpyServer() {
        server.setDispatcher(this);
    }

    void start(int port) throws IOException {
        server.start(InetAddress.getByName("localhost"), port);
    }

    void start() throws IOException {
        server.start();
    }

    void close() throws IOException {
        server.shutdown();
    }

    int port() {
        return server.getPort();
    }

    URI baseUrl() {
        return server.url("/").uri();
    }

    int requestCount() {
        return server.getRequestCount();
    }

    // MockWebServer serves each connection on its own thread; the registries are single-threaded.
    @Override
    public synchronized MockResponse dispatch(RecordedRequest request) {
        HttpUrl url = request.getRequestUrl();
        String path = url.encodedPath();
        String method = request.getMethod();
        int port = port();
        try {
            if (path.equals("/doubles") && method.equals("POST")) {
                Map<?, ?> json = codec.readValue(request.getBody().readByteArray(), Map.class);
                doubles.register(toDouble(json), port);
                return new MockResponse().setResponseCode(201);
            }
            if (path.equals("/proxies") && method.equals("POST")) {
                Map<?, ?> json = codec.readValue(request.getBody().readByteArray(), Map.class);
                String id = (String) json.get("id");
                String pattern = (String) json.get("pattern");
                URI redirectUrl = URI.create((String) json.get("redirect_url"));
                proxies.register(id == null ? new ProxyRoute(pattern, redirectUrl)
                        : new ProxyRoute(id, pattern, redirectUrl), port);
                return new MockResponse().setResponseCode(201);
            }
            if (path.startsWith("/doubles/") && method.equals("DELETE")) {
                doubles.unregister(path.substring("/doubles/".length()), port);
                return new MockResponse().setResponseCode(204);
            }
            if (path.equals("/doubles") && method.equals("DELETE")) {
                doubles.reset(port);
                return new MockResponse().setResponseCode(204);
            }
            if (path.equals("/proxies") && method.equals("DELETE")) {
                proxies.reset(port);
                return new MockResponse().setResponseCode(204);
            }
            if (path.equals("/spy") && method.equals("DELETE")) {
                spyLog.reset(port);
                return new MockResponse().setResponseCode(204);
            }
            if (path.equals("/spy") && method.equals("GET")) {
                return new MockResponse().setBody(new Buffer().write(codec.writeBytes(spyLog.entries(port))));
            }
        } catch (JsonException e) {
            return new MockResponse().setResponseCode(400).setBody(e.getMessage());
        }

        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : request.getHeaders().names()) {
            headers.put(name, request.getHeader(name));
        }
        Response response = dispatcher.dispatch(port, new IncomingRequest(
                method, path, url.encodedQuery(), headers, request.getBody().readByteArray()));

        MockResponse out = new MockResponse().setResponseCode(response.statusCode());
        response.headers().forEach(out::addHeader);
        return out.setBody(new Buffer().write(response.body()));
    }

    @SuppressWarnings("unchecked")
    private static ResponseDouble toDouble(Map<?, ?> json) {
        Object status = json.get("status_code");
        Object headers = json.get("headers");
        Object body = json.get("body");
        String id = (String) json.get("id");
        String pattern = (String) json.get("pattern");
        int statusCode = status == null ? ResponseDouble.DEFAULT_STATUS_CODE : ((Number) status).intValue();
        Map<String, String> headerMap = headers == null ? Map.of() : (Map<String, String>) headers;
        byte[] bytes = body == null ? new byte[0] : ((String) body).getBytes(StandardCharsets.UTF_8);
        return id == null
                ? new ResponseDouble(pattern, statusCode, headerMap, bytes)
                : new ResponseDouble(id, pattern, statusCode, headerMap, bytes);
    }
}
