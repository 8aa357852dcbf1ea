package uz.greenwhite.oauth2client.auth;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import uz.greenwhite.oauth2client.model.EndpointConfig;
import uz.greenwhite.oauth2client.token.TokenRequest;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * client_secret_basic: credentials in the Authorization header
 */
@Component
public class BasicHeaderClientAuthenticator implements ClientAuthenticator {

    @Override
    public boolean supports(EndpointConfig config) {
        return config.isAuthorizationHeader();
    }

    @Override
    public void authenticate(TokenRequest request, EndpointConfig config) {
        request.header(HttpHeaders.AUTHORIZATION,
                basicAuthorization(config.getClientId(), config.getClientSecret()));
    }

    public static String basicAuthorization(String clientId, String clientSecret) {
        String credentials = clientId + ":" + clientSecret;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }
}
