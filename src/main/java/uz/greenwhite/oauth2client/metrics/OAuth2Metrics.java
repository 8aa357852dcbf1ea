package uz.greenwhite.oauth2client.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

/**
 * Token exchange, refresh and request decoration metrics.
 *
 * Naming convention:
 *   oauth2.{operation}.{metric_type}
 *
 * Tags:
 *   result = success | error | attached | skipped
 */
@Getter
@Component
public class OAuth2Metrics {

    private final MeterRegistry registry;

    // ==================== Token request ====================
    private final Timer tokenRequestTimer;
    private final Counter tokenRequestSuccess;
    private final Counter tokenRequestError;

    // ==================== Refresh ====================
    private final Counter refreshSuccess;
    private final Counter refreshFailed;

    // ==================== Attach ====================
    private final Counter tokenAttached;
    private final Counter tokenSkipped;

    public OAuth2Metrics(MeterRegistry registry) {
        this.registry = registry;

        this.tokenRequestTimer = Timer.builder("oauth2.token.request.duration")
                .description("Time taken by token endpoint round trips")
                .register(registry);

        this.tokenRequestSuccess = Counter.builder("oauth2.token.request.total")
                .description("Token requests by result")
                .tag("result", "success")
                .register(registry);

        this.tokenRequestError = Counter.builder("oauth2.token.request.total")
                .description("Token requests by result")
                .tag("result", "error")
                .register(registry);

        this.refreshSuccess = Counter.builder("oauth2.token.refresh.total")
                .description("Refresh token exchanges by result")
                .tag("result", "success")
                .register(registry);

        this.refreshFailed = Counter.builder("oauth2.token.refresh.total")
                .description("Refresh token exchanges by result")
                .tag("result", "error")
                .register(registry);

        this.tokenAttached = Counter.builder("oauth2.attach.total")
                .description("Outbound requests decorated with an access token")
                .tag("result", "attached")
                .register(registry);

        this.tokenSkipped = Counter.builder("oauth2.attach.total")
                .description("Outbound requests decorated with an access token")
                .tag("result", "skipped")
                .register(registry);
    }
}
