package uz.greenwhite.oauth2client.token;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.oauth2client.auth.ClientAuthenticator;
import uz.greenwhite.oauth2client.config.HttpClientConfig;
import uz.greenwhite.oauth2client.exception.OAuth2ConfigurationException;
import uz.greenwhite.oauth2client.exception.OAuth2ProtocolException;
import uz.greenwhite.oauth2client.grant.GrantStrategyRegistry;
import uz.greenwhite.oauth2client.metrics.OAuth2Metrics;
import uz.greenwhite.oauth2client.model.AccessToken;
import uz.greenwhite.oauth2client.model.EndpointConfig;
import uz.greenwhite.oauth2client.token.decoder.ProviderError;
import uz.greenwhite.oauth2client.token.decoder.TokenResponseDecoder;
import uz.greenwhite.oauth2client.transport.TokenEndpointTransport;
import uz.greenwhite.oauth2client.transport.TokenHttpResponse;
import uz.greenwhite.oauth2client.validation.EndpointConfigValidator;
import uz.greenwhite.oauth2client.validation.EndpointField;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one token request: grant fields, client authentication, POST, decode, classify.
 */
@Slf4j
@Component
public class TokenRequestExecutor {

    public static final Duration CONNECT_TIMEOUT = Duration.ofMillis(HttpClientConfig.TOKEN_CONNECT_TIMEOUT_MS);
    public static final Duration READ_TIMEOUT = Duration.ofMillis(HttpClientConfig.TOKEN_READ_TIMEOUT_MS);

    private final GrantStrategyRegistry grantStrategies;
    private final List<ClientAuthenticator> clientAuthenticators;
    private final List<TokenResponseDecoder> decoders;
    private final TokenEndpointTransport transport;
    private final EndpointConfigValidator validator;
    private final OAuth2Metrics metrics;

    public TokenRequestExecutor(GrantStrategyRegistry grantStrategies,
                                List<ClientAuthenticator> clientAuthenticators,
                                List<TokenResponseDecoder> decoders,
                                TokenEndpointTransport transport,
                                EndpointConfigValidator validator,
                                OAuth2Metrics metrics) {
        this.grantStrategies = grantStrategies;
        this.clientAuthenticators = List.copyOf(clientAuthenticators);
        this.decoders = List.copyOf(decoders);
        this.transport = transport;
        this.validator = validator;
        this.metrics = metrics;
    }

    public AccessToken execute(EndpointConfig config, Map<String, String> params) {
        validator.require(config, EndpointField.GRANT_TYPE, EndpointField.ACCESS_TOKEN_URI);
        URI tokenUri = toUri(config.getAccessTokenUri());

        TokenRequest request = new TokenRequest(config.getGrantType(), CONNECT_TIMEOUT, READ_TIMEOUT);
        grantStrategies.get(config.getGrantType()).prepare(request, config, params);
        authenticate(request, config);

        TokenHttpResponse response = metrics.getTokenRequestTimer()
                .record(() -> transport.post(tokenUri, request));

        Map<String, Object> body = decode(response);

        ProviderError error = ProviderError.from(body)
                .orElseGet(() -> response.isOk() ? null : ProviderError.unknown());
        if (error != null) {
            metrics.getTokenRequestError().increment();
            log.warn("Token request to {} failed: status={}, code={}, shape={}",
                    tokenUri, response.status(), error.code(), error.shape());
            throw error.toException();
        }

        metrics.getTokenRequestSuccess().increment();
        log.info("Access token obtained from {} (grant={})", tokenUri, config.getGrantType());

        return toAccessToken(body, config.getAccessQueryParam());
    }

    /**
     * Map a decoded token response onto an AccessToken.
     * A missing token_type becomes {@link AccessToken#DRAFT_10_TOKEN_TYPE}.
     */
    public static AccessToken toAccessToken(Map<String, Object> body, String queryParam) {
        Map<String, Object> params = new LinkedHashMap<>(body);
        Object accessToken = params.remove("access_token");
        Object tokenType = params.remove("token_type");
        Object refreshToken = body.get("refresh_token");

        return AccessToken.builder()
                .accessToken(accessToken == null ? null : accessToken.toString())
                .tokenType(tokenType == null ? AccessToken.DRAFT_10_TOKEN_TYPE : tokenType.toString())
                .queryParam(queryParam)
                .refreshToken(refreshToken == null ? null : refreshToken.toString())
                .params(params)
                .build();
    }

    void authenticate(TokenRequest request, EndpointConfig config) {
        validator.require(config, EndpointField.CLIENT_ID, EndpointField.CLIENT_SECRET);

        ClientAuthenticator authenticator = clientAuthenticators.stream()
                .filter(candidate -> candidate.supports(config))
                .findFirst()
                .orElseThrow(() -> new OAuth2ConfigurationException("No client authenticator for endpoint"));
        authenticator.authenticate(request, config);
    }

    /**
     * An unreadable body on a failed response (a proxy error page, say) is read as empty
     * so the status decides the error; on a 200 it is an invalid response.
     */
    private Map<String, Object> decode(TokenHttpResponse response) {
        try {
            return decoderFor(response.contentType()).decode(response.body());
        } catch (OAuth2ProtocolException e) {
            if (response.isOk()) {
                metrics.getTokenRequestError().increment();
                throw e;
            }
            log.debug("Unreadable token response body with status={}, content-type={}",
                    response.status(), response.contentType());
            return Map.of();
        }
    }

    private TokenResponseDecoder decoderFor(String contentType) {
        return decoders.stream()
                .filter(decoder -> decoder.supports(contentType))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No token response decoder for " + contentType));
    }

    static URI toUri(String uri) {
        try {
            return URI.create(uri);
        } catch (IllegalArgumentException e) {
            throw new OAuth2ConfigurationException("Invalid access-token-uri: " + uri);
        }
    }
}
