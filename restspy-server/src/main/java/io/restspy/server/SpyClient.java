package io.restspy.server;

import io.restspy.core.ProxyRoute;
import io.restspy.core.ResponseDouble;
import io.restspy.core.RestSpyException;
import io.restspy.core.SpyRecord;
import io.restspy.http.spi.HttpClientException;
import io.restspy.http.spi.HttpClientResponse;
import io.restspy.json.spi.JsonCodec;
import io.restspy.json.spi.JsonException;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Configures doubles and proxy routes on a running {@link Server} and reads its spy log.
 *
 * <p>Definitions travel as JSON objects with snake_case keys:
 * <pre>{@code
 * POST /doubles  {"id", "pattern", "status_code", "headers", "body"}
 * POST /proxies  {"id", "pattern", "redirect_url"}
 * GET  /spy      [{"method", "endpoint", "body", "response": {"type", "status_code", "body"}}]
 * }</pre>
 */
public final class SpyClient {

    private static final String JSON = "application/json";
    private static final String PROXIES_ENDPOINT = "/proxies";

    private final Server server;
    private final JsonCodec codec;

    public SpyClient(Server server, JsonCodec codec) {
        this.server = Objects.requireNonNull(server, "server");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public void createDouble(ResponseDouble responseDouble) throws HttpClientException, JsonException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", responseDouble.id());
        payload.put("pattern", responseDouble.pattern());
        payload.put("status_code", responseDouble.statusCode());
        payload.put("headers", responseDouble.headers());
        payload.put("body", new String(responseDouble.body(), StandardCharsets.UTF_8));
        expectSuccess(server.post(ExternalServer.DOUBLES_ENDPOINT, codec.writeBytes(payload), JSON), "create double");
    }

    public void createProxy(ProxyRoute route) throws HttpClientException, JsonException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", route.id());
        payload.put("pattern", route.pattern());
        payload.put("redirect_url", route.redirectUrl().toString());
        expectSuccess(server.post(PROXIES_ENDPOINT, codec.writeBytes(payload), JSON), "create proxy");
    }

    public void removeDouble(String id) throws HttpClientException {
        expectSuccess(server.delete(ExternalServer.DOUBLES_ENDPOINT + "/" + id), "remove double " + id);
    }

    public List<SpyRecord> requests() throws HttpClientException, JsonException {
        return codec.readList(server.get(ExternalServer.SPY_ENDPOINT), SpyRecord.class);
    }

    public void reset() throws HttpClientException {
        expectSuccess(server.delete(ExternalServer.DOUBLES_ENDPOINT), "reset doubles");
        expectSuccess(server.delete(PROXIES_ENDPOINT), "reset proxies");
        expectSuccess(server.delete(ExternalServer.SPY_ENDPOINT), "reset spy log");
    }

    private static void expectSuccess(HttpClientResponse response, String action) {
        int status = response.statusCode();
        if (status < 200 || status > 299) {
            throw new RestSpyException.HttpStatus("Failed to " + action + ": status " + status, status);
        }
    }
}
