package io.restspy.dispatch;

import io.restspy.core.MatchableRegistry;
import io.restspy.core.ProxyRoute;
import io.restspy.core.Response;
import io.restspy.core.ResponseDouble;
import io.restspy.core.SpyRecord;
import io.restspy.http.spi.HttpClientAdapter;
import io.restspy.http.spi.HttpClientException;
import io.restspy.http.spi.HttpClientRequest;
import io.restspy.http.spi.HttpClientResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides how a mock server answers a request.
 *
 * <p>Doubles win over proxy routes; when neither matches the answer is
 * {@link Response#notFound()}. Within each registry the most recently registered
 * match is used. Proxied requests go to the route's redirect URL with the request's
 * path and query appended. Every dispatched request is appended to the {@link SpyLog}.
 *
 * <p>Instances share the thread-safety of their registries, which is none.
 */
public final class RequestDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    public static final int BAD_GATEWAY = 502;

    private static final Set<String> NON_FORWARDED_HEADERS = Set.of(
            "host", "connection", "content-length", "expect", "upgrade",
            "keep-alive", "proxy-connection", "transfer-encoding", "te", "trailer");

    private final MatchableRegistry<ResponseDouble> doubles;
    private final MatchableRegistry<ProxyRoute> proxies;
    private final SpyLog spyLog;
    private final HttpClientAdapter httpClient;

    public RequestDispatcher(MatchableRegistry<ResponseDouble> doubles,
                             MatchableRegistry<ProxyRoute> proxies,
                             SpyLog spyLog,
                             HttpClientAdapter httpClient) {
        this.doubles = Objects.requireNonNull(doubles, "doubles");
        this.proxies = Objects.requireNonNull(proxies, "proxies");
        this.spyLog = Objects.requireNonNull(spyLog, "spyLog");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public Response dispatch(int port, IncomingRequest request) {
        Response response = resolve(port, request);
        spyLog.record(port, new SpyRecord(
                request.method(),
                request.endpoint(),
                new String(request.body(), StandardCharsets.UTF_8),
                response.toRepresentation()));
        return response;
    }

    /**
     * Resets doubles, proxy routes and the spy log of one port.
     */
    public void reset(int port) {
        doubles.reset(port);
        proxies.reset(port);
        spyLog.reset(port);
    }

    private Response resolve(int port, IncomingRequest request) {
        Optional<ResponseDouble> responseDouble = doubles.findForEndpoint(request.path(), port);
        if (responseDouble.isPresent()) {
            log.debug("{} {} on port {} answered by {}", request.method(), request.path(), port, responseDouble.get());
            return Response.fromDouble(responseDouble.get());
        }

        Optional<ProxyRoute> route = proxies.findForEndpoint(request.path(), port);
        if (route.isPresent()) {
            return forward(route.get(), request);
        }

        log.debug("{} {} on port {} has no double or proxy", request.method(), request.path(), port);
        return Response.notFound();
    }

    private Response forward(ProxyRoute route, IncomingRequest request) {
        URI target;
        try {
            target = upstreamUri(route.redirectUrl(), request.endpoint());
        } catch (IllegalArgumentException e) {
            log.warn("Cannot proxy {} {}: bad upstream URL for {}", request.method(), request.endpoint(), route, e);
            return Response.proxy(BAD_GATEWAY, Map.of(), new byte[0]);
        }
        HttpClientRequest.Builder upstream = HttpClientRequest.request(request.method(), target)
                .headers(forwardableHeaders(request.headers()));
        if (request.body().length > 0) {
            upstream.body(request.body());
        }

        try {
            HttpClientResponse answer = httpClient.send(upstream.build());
            log.debug("Proxied {} {} to {} -> {}", request.method(), request.path(), target, answer.statusCode());
            return Response.proxy(answer.statusCode(), answer.headers(), answer.body());
        } catch (HttpClientException e) {
            log.warn("Proxying {} {} to {} failed", request.method(), request.path(), target, e);
            return Response.proxy(BAD_GATEWAY, Map.of(), new byte[0]);
        }
    }

    /**
     * Appends the endpoint to the redirect URL, keeping any path prefix it carries:
     * {@code http://up/api/} and {@code /users?id=1} give {@code http://up/api/users?id=1}.
     */
    static URI upstreamUri(URI redirectUrl, String endpoint) {
        String base = redirectUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(endpoint.startsWith("/") ? base + endpoint : base + "/" + endpoint);
    }

    private static Map<String, String> forwardableHeaders(Map<String, String> headers) {
        Map<String, String> out = new LinkedHashMap<>();
        headers.forEach((name, value) -> {
            if (!NON_FORWARDED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                out.put(name, value);
            }
        });
        return out;
    }
}
