package uz.greenwhite.oauth2client.grant;

import org.springframework.stereotype.Component;
import uz.greenwhite.oauth2client.model.EndpointConfig;
import uz.greenwhite.oauth2client.token.TokenRequest;

import java.util.Map;

/**
 * Resource owner password credentials. Credentials are not checked here,
 * absent values surface as missing fields on the server side.
 */
@Component
public class PasswordGrantStrategy implements GrantStrategy {

    private static final String NAME = "password";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void prepare(TokenRequest request, EndpointConfig config, Map<String, String> params) {
        request.addFormField("username", params.get("username"))
                .addFormField("password", params.get("password"));
    }
}
