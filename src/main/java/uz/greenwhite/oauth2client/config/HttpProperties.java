package uz.greenwhite.oauth2client.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * oauth2.http.* settings of the client that calls protected resources on behalf of a token.
 * The token endpoint client does not read them, see {@link HttpClientConfig#TOKEN_CONNECT_TIMEOUT_MS}.
 */
@Slf4j
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "oauth2.http")
public class HttpProperties {

    private int connectTimeoutMs = 10_000;
    private int readTimeoutMs = 30_000;
    private int writeTimeoutMs = 30_000;

    /**
     * Largest resource response body kept in memory, bytes
     */
    private int maxInMemorySize = 16 * 1024 * 1024;

    @PostConstruct
    public void validate() {
        requirePositive("connect-timeout-ms", connectTimeoutMs);
        requirePositive("read-timeout-ms", readTimeoutMs);
        requirePositive("write-timeout-ms", writeTimeoutMs);
        requirePositive("max-in-memory-size", maxInMemorySize);

        log.info("Protected resource client: connect={}ms, read={}ms, write={}ms, buffer={}KB",
                connectTimeoutMs, readTimeoutMs, writeTimeoutMs, maxInMemorySize / 1024);
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException("oauth2.http." + key + " must be > 0, got " + value);
        }
    }
}
