package uz.greenwhite.oauth2client.auth;

import org.springframework.stereotype.Component;
import uz.greenwhite.oauth2client.model.EndpointConfig;
import uz.greenwhite.oauth2client.token.TokenRequest;

/**
 * client_secret_post: credentials as form fields
 */
@Component
public class RequestBodyClientAuthenticator implements ClientAuthenticator {

    @Override
    public boolean supports(EndpointConfig config) {
        return !config.isAuthorizationHeader();
    }

    @Override
    public void authenticate(TokenRequest request, EndpointConfig config) {
        request.addFormField("client_id", config.getClientId())
                .addFormField("client_secret", config.getClientSecret());
    }
}
