package uz.greenwhite.oauth2client.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Immutable description of one OAuth2 provider endpoint.
 * Which fields are required depends on the operation; see {@code EndpointConfigValidator}.
 */
@Value
@Builder(toBuilder = true)
public class EndpointConfig {

    String clientId;
    String clientSecret;

    /**
     * Grant type name, e.g. "authorization_code" or "password"
     */
    String grantType;

    String authorizationUri;
    String accessTokenUri;
    String redirectUri;

    List<String> scope;

    /**
     * Query parameter used to carry the access token instead of the Authorization header
     */
    String accessQueryParam;

    /**
     * true: client credentials go to a Basic Authorization header,
     * false: client_id / client_secret go to the request body
     */
    boolean authorizationHeader;

    // Optional authorization request extras (Google style)
    String accessType;

    List<String> prompt;

    String includeGrantedScopes;
    String loginHint;
}
