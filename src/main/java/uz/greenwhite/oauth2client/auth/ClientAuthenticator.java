package uz.greenwhite.oauth2client.auth;

import uz.greenwhite.oauth2client.model.EndpointConfig;
import uz.greenwhite.oauth2client.token.TokenRequest;

/**
 * Attaches the client credentials to a token request.
 * Exactly one implementation supports a given endpoint configuration.
 */
public interface ClientAuthenticator {

    boolean supports(EndpointConfig config);

    void authenticate(TokenRequest request, EndpointConfig config);
}
