package uz.greenwhite.oauth2client.client;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import uz.greenwhite.oauth2client.config.HttpClientConfig;
import uz.greenwhite.oauth2client.config.HttpProperties;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientRequestExecutorTest {

    private MockWebServer server;
    private WebClientRequestExecutor executor;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        executor = new WebClientRequestExecutor(new HttpClientConfig(new HttpProperties()).resourceWebClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void sendsHeadersQueryAndBody() throws InterruptedException {
        server.enqueue(new MockResponse().setResponseCode(201).setBody("created"));

        OutboundRequest request = OutboundRequest.builder()
                .method(HttpMethod.POST)
                .url(server.url("/items?existing=1").toString())
                .queryParams(Map.of("access_token", "sesame"))
                .headers(Map.of("Content-Type", "application/json"))
                .body("{\"name\":\"x\"}")
                .build();

        ResourceResponse response = executor.execute(request);

        assertThat(response.status()).isEqualTo(201);
        assertThat(response.body()).isEqualTo("created");

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded).isNotNull();
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getPath()).isEqualTo("/items?existing=1&access_token=sesame");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"name\":\"x\"}");
    }

    @Test
    void queryParamValuesAreStrictlyEncoded() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("ok"));

        executor.execute(OutboundRequest.builder()
                .url(server.url("/me").toString())
                .queryParams(Map.of("access_token", "a+b c"))
                .build());

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded).isNotNull();
        assertThat(recorded.getPath()).isEqualTo("/me?access_token=a%2Bb%20c");
        assertThat(recorded.getRequestUrl().queryParameter("access_token")).isEqualTo("a+b c");
    }

    @Test
    void errorStatusReturnedWhenLenient() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("denied"));

        ResourceResponse response = executor.execute(OutboundRequest.builder()
                .url(server.url("/me").toString())
                .build());

        assertThat(response.status()).isEqualTo(401);
        assertThat(response.body()).isEqualTo("denied");
    }

    @Test
    void errorStatusThrowsWhenStrict() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        OutboundRequest request = OutboundRequest.builder()
                .url(server.url("/me").toString())
                .throwExceptions(true)
                .build();

        assertThatThrownBy(() -> executor.execute(request))
                .isInstanceOf(WebClientResponseException.class);
    }
}
