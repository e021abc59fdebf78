package io.restspy.http.spi;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpClientRequestTest {

    private static final URI URL = URI.create("http://localhost:1234/doubles");

    @Test
    void builderCollectsHeadersAndTimeout() {
        HttpClientRequest request = HttpClientRequest.post(URL)
                .header("content-type", "application/json")
                .headers(Map.of("X-Trace", "1"))
                .timeout(Duration.ofSeconds(1))
                .build();

        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.headers()).containsEntry("X-Trace", "1");
        assertThat(request.contentType()).isEqualTo("application/json");
        assertThat(request.timeout()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void requestWithoutHeadersHasEmptyMap() {
        HttpClientRequest request = HttpClientRequest.get(URL).build();

        assertThat(request.headers()).isEmpty();
        assertThat(request.contentType()).isNull();
        assertThat(request.body()).isNull();
    }

    @Test
    void headerSetTwiceInDifferentCaseKeepsLastValue() {
        HttpClientRequest request = HttpClientRequest.get(URL)
                .header("X-Spy", "one")
                .header("x-spy", "two")
                .build();

        assertThat(request.headers()).hasSize(1).containsEntry("X-SPY", "two");
    }

    @Test
    void forwardedMethodIsUpperCased() {
        assertThat(HttpClientRequest.request("patch", URL).build().method()).isEqualTo("PATCH");
    }

    @Test
    void bodyIsCopiedAtBuild() {
        byte[] body = "draft".getBytes(StandardCharsets.UTF_8);
        HttpClientRequest request = HttpClientRequest.post(URL).body(body).build();

        body[0] = 'D';

        assertThat(new String(request.body(), StandardCharsets.UTF_8)).isEqualTo("draft");
    }

    @Test
    void nonPositiveTimeoutIsRejected() {
        assertThatThrownBy(() -> HttpClientRequest.get(URL).timeout(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
