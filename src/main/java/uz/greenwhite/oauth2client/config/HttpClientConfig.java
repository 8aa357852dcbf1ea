package uz.greenwhite.oauth2client.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Two WebClients: one for token endpoints (exchange and refresh) with fixed timeouts,
 * one for protected resources configured through {@link HttpProperties}.
 */
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    public static final int TOKEN_CONNECT_TIMEOUT_MS = 10_000;
    public static final int TOKEN_READ_TIMEOUT_MS = 10_000;

    private final HttpProperties httpProperties;

    @Bean("tokenEndpointWebClient")
    public WebClient tokenEndpointWebClient() {
        HttpClient httpClient = timeouts(HttpClient.create(), TOKEN_CONNECT_TIMEOUT_MS, TOKEN_READ_TIMEOUT_MS);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Bean
    @Primary
    public WebClient resourceWebClient() {
        HttpClient httpClient = timeouts(HttpClient.create(),
                httpProperties.getConnectTimeoutMs(), httpProperties.getReadTimeoutMs())
                .doOnConnected(conn -> conn.addHandlerLast(
                        new WriteTimeoutHandler(httpProperties.getWriteTimeoutMs(), TimeUnit.MILLISECONDS)));

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(httpProperties.getMaxInMemorySize()))
                .build();
    }

    private static HttpClient timeouts(HttpClient httpClient, int connectMs, int readMs) {
        return httpClient
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectMs)
                .responseTimeout(Duration.ofMillis(readMs))
                .doOnConnected(conn -> conn.addHandlerLast(new ReadTimeoutHandler(readMs, TimeUnit.MILLISECONDS)));
    }
}
