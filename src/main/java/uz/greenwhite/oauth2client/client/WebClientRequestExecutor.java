package uz.greenwhite.oauth2client.client;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import uz.greenwhite.oauth2client.util.QueryParams;

import java.net.URI;

/**
 * Plain WebClient execution of an OutboundRequest. With throwExceptions set,
 * 4xx/5xx answers raise WebClientResponseException, otherwise they are returned.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebClientRequestExecutor implements RequestExecutor<ResourceResponse> {

    private final WebClient webClient;

    @Override
    public ResourceResponse execute(OutboundRequest request) {
        URI uri = buildUri(request);
        log.info("Sending HTTP request: {} {}", request.getMethod(), uri.getPath());

        WebClient.RequestBodySpec spec = webClient
                .method(request.getMethod())
                .uri(uri)
                .headers(h -> request.getHeaders().forEach(h::set));

        WebClient.RequestHeadersSpec<?> withBody = request.getBody() != null
                ? spec.bodyValue(request.getBody())
                : spec;

        Mono<ResponseEntity<String>> exchange = request.isThrowExceptions()
                ? withBody.retrieve().toEntity(String.class)
                : withBody.exchangeToMono(response -> response.toEntity(String.class));

        ResponseEntity<String> entity = exchange.block();
        if (entity == null) {
            throw new IllegalStateException("No response for " + request.getMethod() + " " + uri);
        }

        log.info("HTTP response: {} {} -> status={}", request.getMethod(), uri.getPath(), entity.getStatusCode().value());
        return new ResourceResponse(entity.getStatusCode().value(), entity.getHeaders(), entity.getBody());
    }

    /**
     * Query params are merged into whatever query the url already has
     */
    static URI buildUri(OutboundRequest request) {
        return URI.create(QueryParams.set(request.getUrl(), request.getQueryParams()));
    }
}
