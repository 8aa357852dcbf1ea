package uz.greenwhite.oauth2client.authorization;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.oauth2client.model.AuthRequest;
import uz.greenwhite.oauth2client.model.EndpointConfig;
import uz.greenwhite.oauth2client.util.QueryParams;
import uz.greenwhite.oauth2client.validation.EndpointConfigValidator;
import uz.greenwhite.oauth2client.validation.EndpointField;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the URI the user agent is redirected to for approving access.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthorizationRequestBuilder {

    public static final String RESPONSE_TYPE_CODE = "code";

    private final EndpointConfigValidator validator;

    public AuthRequest build(EndpointConfig config) {
        return build(config, null);
    }

    /**
     * Merge the authorization parameters onto the query already present in authorization-uri.
     *
     * @param state opaque value echoed back on the callback, may be null
     */
    public AuthRequest build(EndpointConfig config, String state) {
        validator.require(config, EndpointField.AUTHORIZATION_URI, EndpointField.CLIENT_ID);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", config.getClientId());
        params.put("redirect_uri", config.getRedirectUri());
        params.put("response_type", RESPONSE_TYPE_CODE);
        params.put("state", state);
        params.put("access_type", config.getAccessType());
        params.put("scope", joinWithSpaces(config.getScope()));
        params.put("prompt", joinWithSpaces(config.getPrompt()));
        params.put("include_granted_scopes", config.getIncludeGrantedScopes());
        params.put("login_hint", config.getLoginHint());

        String built = QueryParams.set(config.getAuthorizationUri(), params);
        log.debug("Authorization request built for client '{}'", config.getClientId());

        return new AuthRequest(built, config.getScope(), state);
    }

    private static String joinWithSpaces(List<String> values) {
        return values == null ? null : String.join(" ", values);
    }
}
