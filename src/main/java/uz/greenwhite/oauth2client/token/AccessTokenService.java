package uz.greenwhite.oauth2client.token;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uz.greenwhite.oauth2client.exception.OAuth2ProtocolException;
import uz.greenwhite.oauth2client.exception.OAuth2StateMismatchException;
import uz.greenwhite.oauth2client.metrics.OAuth2Metrics;
import uz.greenwhite.oauth2client.model.AccessToken;
import uz.greenwhite.oauth2client.model.AuthRequest;
import uz.greenwhite.oauth2client.model.EndpointConfig;
import uz.greenwhite.oauth2client.token.decoder.JsonTokenResponseDecoder;
import uz.greenwhite.oauth2client.transport.TokenEndpointTransport;
import uz.greenwhite.oauth2client.transport.TokenHttpResponse;
import uz.greenwhite.oauth2client.validation.EndpointConfigValidator;
import uz.greenwhite.oauth2client.validation.EndpointField;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry points for obtaining and refreshing access tokens.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessTokenService {

    public static final String REFRESH_TOKEN_GRANT = "refresh_token";

    private final TokenRequestExecutor executor;
    private final TokenEndpointTransport transport;
    private final JsonTokenResponseDecoder jsonDecoder;
    private final EndpointConfigValidator validator;
    private final OAuth2Metrics metrics;

    public AccessToken getAccessToken(EndpointConfig config, Map<String, String> params) {
        return getAccessToken(config, params, null);
    }

    /**
     * Exchange the callback parameters (code, or username/password) for an access token.
     *
     * @param params   callback or credential parameters: code, state, error, error_description,
     *                 username, password
     * @param expected the AuthRequest sent to the user agent, null to skip the state check
     * @throws OAuth2ProtocolException      when the callback carries an error
     * @throws OAuth2StateMismatchException when the returned state differs from the expected one
     */
    public AccessToken getAccessToken(EndpointConfig config, Map<String, String> params, AuthRequest expected) {
        Map<String, String> callback = params == null ? Map.of() : params;

        String error = callback.get("error");
        if (error != null) {
            log.warn("Authorization denied by server: {}", error);
            throw new OAuth2ProtocolException(callback.get("error_description"), error);
        }

        String expectedState = expected == null ? null : expected.state();
        String actualState = callback.get("state");
        if (expectedState != null && !Objects.equals(expectedState, actualState)) {
            log.warn("OAuth2 state mismatch on callback for client '{}'", config == null ? null : config.getClientId());
            throw new OAuth2StateMismatchException(expectedState, actualState);
        }

        return executor.execute(config, callback);
    }

    /**
     * Exchange a refresh token for a new access token.
     * Returns empty when the token endpoint does not answer 200; the caller decides what to do.
     */
    public Optional<AccessToken> refreshAccessToken(String refreshToken, EndpointConfig config) {
        validator.require(config, EndpointField.ACCESS_TOKEN_URI);
        URI tokenUri = TokenRequestExecutor.toUri(config.getAccessTokenUri());

        TokenRequest request = new TokenRequest(REFRESH_TOKEN_GRANT,
                TokenRequestExecutor.CONNECT_TIMEOUT, TokenRequestExecutor.READ_TIMEOUT)
                .addFormField("client_id", config.getClientId())
                .addFormField("client_secret", config.getClientSecret())
                .addFormField("refresh_token", refreshToken);

        TokenHttpResponse response = metrics.getTokenRequestTimer()
                .record(() -> transport.post(tokenUri, request));

        if (!response.isOk()) {
            metrics.getRefreshFailed().increment();
            log.warn("Token refresh at {} returned status={}, no token issued", tokenUri, response.status());
            return Optional.empty();
        }

        metrics.getRefreshSuccess().increment();
        log.info("Access token refreshed at {}", tokenUri);

        Map<String, Object> body = jsonDecoder.decode(response.body());
        return Optional.of(TokenRequestExecutor.toAccessToken(body, config.getAccessQueryParam()));
    }
}
