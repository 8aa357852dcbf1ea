package uz.greenwhite.oauth2client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.http.HttpHeaders;
import uz.greenwhite.oauth2client.auth.BasicHeaderClientAuthenticator;
import uz.greenwhite.oauth2client.auth.RequestBodyClientAuthenticator;
import uz.greenwhite.oauth2client.grant.AuthorizationCodeGrantStrategy;
import uz.greenwhite.oauth2client.grant.GrantStrategyRegistry;
import uz.greenwhite.oauth2client.grant.PasswordGrantStrategy;
import uz.greenwhite.oauth2client.metrics.OAuth2Metrics;
import uz.greenwhite.oauth2client.model.AccessToken;
import uz.greenwhite.oauth2client.model.EndpointConfig;
import uz.greenwhite.oauth2client.token.TokenRequestExecutor;
import uz.greenwhite.oauth2client.token.decoder.FormTokenResponseDecoder;
import uz.greenwhite.oauth2client.token.decoder.JsonTokenResponseDecoder;
import uz.greenwhite.oauth2client.transport.TokenEndpointTransport;
import uz.greenwhite.oauth2client.transport.TokenHttpResponse;
import uz.greenwhite.oauth2client.validation.EndpointConfigValidator;

import java.util.List;
import java.util.Map;

public final class OAuth2Fixtures {

    public static final EndpointConfig ENDPOINT = EndpointConfig.builder()
            .clientId("foo")
            .clientSecret("bar")
            .accessQueryParam("access_token")
            .scope(List.of("foo", "bar"))
            .build();

    public static final EndpointConfig AUTH_CODE_ENDPOINT = ENDPOINT.toBuilder()
            .redirectUri("http://my.host/cb")
            .grantType("authorization_code")
            .authorizationUri("http://localhost:18080/auth")
            .accessTokenUri("http://localhost:18080/token-auth-code")
            .build();

    public static final EndpointConfig RESOURCE_OWNER_ENDPOINT = ENDPOINT.toBuilder()
            .grantType("password")
            .accessTokenUri("http://localhost:18080/token-password")
            .build();

    public static final String JSON_TOKEN_BODY =
            "{\"access_token\":\"sesame\",\"token_type\":\"bearer\",\"expires_in\":120,\"refresh_token\":\"new-foo\"}";

    public static final String FORM_TOKEN_BODY =
            "access_token=sesame&token_type=bearer&expires_in=120&refresh_token=new-foo";

    public static final AccessToken DEFAULT_TOKEN = new AccessToken(
            "sesame", "bearer", "access_token", "new-foo",
            Map.of("expires_in", "120", "refresh_token", "new-foo"));

    private OAuth2Fixtures() {
    }

    public static TokenHttpResponse response(int status, String contentType, String body) {
        HttpHeaders headers = new HttpHeaders();
        if (contentType != null) {
            headers.set(HttpHeaders.CONTENT_TYPE, contentType);
        }
        return new TokenHttpResponse(status, headers, body);
    }

    public static TokenHttpResponse jsonResponse(int status, String body) {
        return response(status, "application/json; charset=UTF-8", body);
    }

    public static OAuth2Metrics metrics() {
        return new OAuth2Metrics(new SimpleMeterRegistry());
    }

    public static GrantStrategyRegistry grantStrategies(EndpointConfigValidator validator) {
        return new GrantStrategyRegistry(List.of(
                new AuthorizationCodeGrantStrategy(validator),
                new PasswordGrantStrategy()));
    }

    public static JsonTokenResponseDecoder jsonDecoder() {
        return new JsonTokenResponseDecoder(new ObjectMapper());
    }

    public static TokenRequestExecutor executor(TokenEndpointTransport transport, OAuth2Metrics metrics) {
        EndpointConfigValidator validator = new EndpointConfigValidator();
        return new TokenRequestExecutor(
                grantStrategies(validator),
                List.of(new BasicHeaderClientAuthenticator(), new RequestBodyClientAuthenticator()),
                List.of(jsonDecoder(), new FormTokenResponseDecoder()),
                transport,
                validator,
                metrics);
    }
}
