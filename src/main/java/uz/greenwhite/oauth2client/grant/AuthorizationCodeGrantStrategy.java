package uz.greenwhite.oauth2client.grant;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uz.greenwhite.oauth2client.exception.OAuth2ConfigurationException;
import uz.greenwhite.oauth2client.model.EndpointConfig;
import uz.greenwhite.oauth2client.token.TokenRequest;
import uz.greenwhite.oauth2client.validation.EndpointConfigValidator;
import uz.greenwhite.oauth2client.validation.EndpointField;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class AuthorizationCodeGrantStrategy implements GrantStrategy {

    private static final String NAME = "authorization_code";

    private final EndpointConfigValidator validator;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void prepare(TokenRequest request, EndpointConfig config, Map<String, String> params) {
        String code = params.get("code");
        if (code == null) {
            throw new OAuth2ConfigurationException(
                    "Grant type 'authorization_code' requires the 'code' parameter", List.of("code"));
        }
        validator.require(config, EndpointField.REDIRECT_URI);

        request.addFormField("code", code)
                .addFormField("redirect_uri", config.getRedirectUri());
    }
}
