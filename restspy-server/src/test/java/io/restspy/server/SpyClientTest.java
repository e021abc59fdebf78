package io.restspy.server;

import io.restspy.core.ProxyRoute;
import io.restspy.core.ResponseDouble;
import io.restspy.core.RestSpyException;
import io.restspy.core.SpyRecord;
import io.restspy.json.jackson.JacksonJsonCodec;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpyClientTest {

    private FakeRestSpyServer fake;
    private ExternalServer server;
    private SpyClient client;

    @BeforeEach
    void setUp() throws Exception {
        fake = new FakeRestSpyServer();
        fake.start();
        server = new ExternalServer(fake.baseUrl());
        client = new SpyClient(server, new JacksonJsonCodec());
    }

    @AfterEach
    void tearDown() throws Exception {
        fake.close();
    }

    private String get(String endpoint) throws Exception {
        return new String(server.get(endpoint), StandardCharsets.UTF_8);
    }

    @Test
    void createdDoubleAnswersMatchingRequests() throws Exception {
        client.createDouble(new ResponseDouble("/users/\\d+", 200, Map.of("X-Test", "yes"), "{\"name\":\"ann\"}"));

        assertThat(get("/users/42")).isEqualTo("{\"name\":\"ann\"}");
        assertThat(server.delete("/users/42").header("X-Test")).contains("yes");
    }

    @Test
    void doubleStatusCodeIsServed() throws Exception {
        client.createDouble(new ResponseDouble("/teapot", 418, Map.of(), "short and stout"));

        assertThatThrownBy(() -> server.get("/teapot"))
                .isInstanceOf(RestSpyException.HttpStatus.class)
                .satisfies(e -> assertThat(((RestSpyException.HttpStatus) e).status()).isEqualTo(418));
    }

    @Test
    void unmatchedRequestIsNotFound() {
        assertThatThrownBy(() -> server.get("/missing"))
                .isInstanceOf(RestSpyException.HttpStatus.class)
                .hasMessage("Status Code (404) is not 200");
    }

    @Test
    void removedDoubleNoLongerAnswers() throws Exception {
        ResponseDouble older = new ResponseDouble("/greeting", "hello");
        ResponseDouble newer = new ResponseDouble("/greeting", "hi");
        client.createDouble(older);
        client.createDouble(newer);
        assertThat(get("/greeting")).isEqualTo("hi");

        client.removeDouble(newer.id());

        assertThat(get("/greeting")).isEqualTo("hello");
    }

    @Test
    void requestsListsEverythingTheServerSaw() throws Exception {
        client.createDouble(new ResponseDouble("/orders", "ok"));
        server.post("/orders", "{\"qty\":3}");
        server.delete("/nowhere");

        List<SpyRecord> records = client.requests();

        assertThat(records).hasSize(2);
        SpyRecord first = records.get(0);
        assertThat(first.method()).isEqualTo("POST");
        assertThat(first.endpoint()).isEqualTo("/orders");
        assertThat(first.body()).isEqualTo("{\"qty\":3}");
        assertThat(first.response())
                .containsEntry("type", "double")
                .containsEntry("status_code", 200)
                .containsEntry("body", "ok");
        assertThat(records.get(1).response())
                .containsEntry("type", "not_found")
                .containsEntry("status_code", 404);
    }

    @Test
    void resetClearsDoublesProxiesAndSpyLog() throws Exception {
        client.createDouble(new ResponseDouble("/a", "a"));
        client.createProxy(new ProxyRoute("/b", fake.baseUrl()));
        get("/a");

        client.reset();

        assertThat(client.requests()).isEmpty();
        assertThatThrownBy(() -> server.get("/a")).isInstanceOf(RestSpyException.HttpStatus.class);
    }

    @Test
    void proxyForwardsToUpstreamAndRecordsDecodedBody() throws Exception {
        MockWebServer upstream = new MockWebServer();
        upstream.enqueue(new MockResponse().setResponseCode(200).setBody("from upstream"));
        upstream.start();
        try {
            client.createProxy(new ProxyRoute("^/api/", upstream.url("/").uri()));

            assertThat(get("/api/items?limit=1")).isEqualTo("from upstream");
            assertThat(upstream.takeRequest().getPath()).isEqualTo("/api/items?limit=1");
            assertThat(client.requests().get(0).response())
                    .containsEntry("type", "proxy")
                    .containsEntry("body", "from upstream");
        } finally {
            upstream.shutdown();
        }
    }

    @Test
    void doublesWinOverProxies() throws Exception {
        client.createProxy(new ProxyRoute("/shared", fake.baseUrl()));
        client.createDouble(new ResponseDouble("/shared", "double"));

        assertThat(get("/shared")).isEqualTo("double");
    }

    @Test
    void rejectedControlCallRaisesHttpStatus() throws Exception {
        MockWebServer refusing = new MockWebServer();
        refusing.enqueue(new MockResponse().setResponseCode(500));
        refusing.start();
        try {
            SpyClient rejected = new SpyClient(new ExternalServer(refusing.url("/").uri()), new JacksonJsonCodec());

            assertThatThrownBy(() -> rejected.removeDouble("x"))
                    .isInstanceOf(RestSpyException.HttpStatus.class)
                    .hasMessageContaining("remove double x")
                    .satisfies(e -> assertThat(((RestSpyException.HttpStatus) e).status()).isEqualTo(500));
        } finally {
            refusing.shutdown();
        }
    }
}
