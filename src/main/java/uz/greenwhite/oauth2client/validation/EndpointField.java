package uz.greenwhite.oauth2client.validation;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import uz.greenwhite.oauth2client.model.EndpointConfig;

import java.util.function.Function;

@Getter
@RequiredArgsConstructor
public enum EndpointField {

    CLIENT_ID("client-id", EndpointConfig::getClientId),
    CLIENT_SECRET("client-secret", EndpointConfig::getClientSecret),
    GRANT_TYPE("grant-type", EndpointConfig::getGrantType),
    AUTHORIZATION_URI("authorization-uri", EndpointConfig::getAuthorizationUri),
    ACCESS_TOKEN_URI("access-token-uri", EndpointConfig::getAccessTokenUri),
    REDIRECT_URI("redirect-uri", EndpointConfig::getRedirectUri);

    private final String key;
    private final Function<EndpointConfig, String> accessor;

    public boolean isPresent(EndpointConfig config) {
        String value = accessor.apply(config);
        return value != null && !value.isBlank();
    }
}
