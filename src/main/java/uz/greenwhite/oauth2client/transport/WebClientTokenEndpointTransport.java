package uz.greenwhite.oauth2client.transport;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClientRequest;
import uz.greenwhite.oauth2client.exception.OAuth2TransportException;
import uz.greenwhite.oauth2client.token.TokenRequest;

import java.net.URI;

@Slf4j
@Component
public class WebClientTokenEndpointTransport implements TokenEndpointTransport {

    private final WebClient webClient;

    public WebClientTokenEndpointTransport(@Qualifier("tokenEndpointWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public TokenHttpResponse post(URI uri, TokenRequest request) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        request.getForm().forEach(form::add);

        try {
            TokenHttpResponse response = webClient.post()
                    .uri(uri)
                    .contentType(MediaType.parseMediaType(request.getContentType()))
                    .accept(MediaType.APPLICATION_JSON, MediaType.APPLICATION_FORM_URLENCODED, MediaType.ALL)
                    .headers(h -> request.getHeaders().forEach(h::set))
                    .httpRequest(httpRequest -> {
                        HttpClientRequest nativeRequest = httpRequest.getNativeRequest();
                        nativeRequest.responseTimeout(request.getReadTimeout());
                    })
                    .body(BodyInserters.fromFormData(form))
                    // status is inspected by the caller, never turned into an exception here
                    .exchangeToMono(clientResponse -> clientResponse.toEntity(String.class))
                    .map(entity -> new TokenHttpResponse(
                            entity.getStatusCode().value(), entity.getHeaders(), entity.getBody()))
                    .block();

            if (response == null) {
                throw new OAuth2TransportException("Empty answer from token endpoint " + uri, null);
            }

            log.debug("Token endpoint {} answered status={}", uri, response.status());
            return response;

        } catch (OAuth2TransportException e) {
            throw e;
        } catch (Exception e) {
            log.error("Token endpoint request failed {}: {}", uri, e.getMessage());
            throw new OAuth2TransportException("Token endpoint request failed: " + e.getMessage(), e);
        }
    }
}
