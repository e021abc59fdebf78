package io.restspy.http.spi;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpClientAdapterTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    static Stream<HttpClientAdapter> adapters() {
        return Stream.of(
                JdkHttpClientAdapter.create(),
                ApacheHttpClientAdapter.create(),
                OkHttpClientAdapter.create());
    }

    @ParameterizedTest
    @MethodSource("adapters")
    void getReturnsStatusHeadersAndBody(HttpClientAdapter adapter) throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("X-Spy", "yes")
                .setBody("hello"));

        HttpClientResponse response = adapter.send(HttpClientRequest.get(server.url("/test").uri()).build());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.header("x-spy")).contains("yes");
        assertThat(response.headers()).containsKey("X-Spy");
        assertThat(new String(response.body(), StandardCharsets.UTF_8)).isEqualTo("hello");

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("GET");
        assertThat(recorded.getPath()).isEqualTo("/test");
    }

    @ParameterizedTest
    @MethodSource("adapters")
    void headerNamesAreCaseInsensitiveForEveryAdapter(HttpClientAdapter adapter) throws Exception {
        server.enqueue(new MockResponse()
                .addHeader("Content-Encoding", "identity")
                .addHeader("X-Spy", "first")
                .setBody("ok"));

        HttpClientResponse response = adapter.send(HttpClientRequest.get(server.url("/case").uri()).build());

        assertThat(response.headers())
                .containsEntry("content-encoding", "identity")
                .containsEntry("CONTENT-ENCODING", "identity")
                .containsEntry("x-spy", "first")
                .containsEntry("X-SPY", "first");
        assertThat(response.header("X-sPy")).contains("first");
    }

    @ParameterizedTest
    @MethodSource("adapters")
    void postSendsBodyAndContentType(HttpClientAdapter adapter) throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201));

        HttpClientRequest request = HttpClientRequest.post(server.url("/doubles").uri())
                .header("Content-Type", "application/json")
                .body("{\"pattern\":\"/x\"}".getBytes(StandardCharsets.UTF_8))
                .build();
        HttpClientResponse response = adapter.send(request);

        assertThat(response.statusCode()).isEqualTo(201);
        assertThat(response.body()).isEmpty();

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getHeader("Content-Type")).startsWith("application/json");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"pattern\":\"/x\"}");
    }

    @ParameterizedTest
    @MethodSource("adapters")
    void deleteDoesNotCheckStatus(HttpClientAdapter adapter) throws Exception {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        HttpClientResponse response = adapter.send(HttpClientRequest.delete(server.url("/spy").uri()).build());

        assertThat(response.statusCode()).isEqualTo(500);
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getMethod()).isEqualTo("DELETE");
    }

    @ParameterizedTest
    @MethodSource("adapters")
    void refusedConnectionIsReportedAsConnectFailure(HttpClientAdapter adapter) throws Exception {
        URI closed = URI.create("http://localhost:" + unusedPort() + "/");

        assertThatThrownBy(() -> adapter.send(HttpClientRequest.get(closed).timeout(Duration.ofSeconds(2)).build()))
                .isInstanceOf(HttpConnectException.class);
    }

    @ParameterizedTest
    @MethodSource("adapters")
    void slowResponseTimesOut(HttpClientAdapter adapter) {
        server.enqueue(new MockResponse().setBody("late").setHeadersDelay(2, TimeUnit.SECONDS));

        HttpClientRequest request = HttpClientRequest.get(server.url("/slow").uri())
                .timeout(Duration.ofMillis(200))
                .build();

        assertThatThrownBy(() -> adapter.send(request))
                .isInstanceOf(HttpTimeoutException.class);
    }

    private static int unusedPort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }
}
