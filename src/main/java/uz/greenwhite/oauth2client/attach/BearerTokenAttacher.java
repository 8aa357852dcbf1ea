package uz.greenwhite.oauth2client.attach;

import org.springframework.stereotype.Component;
import uz.greenwhite.oauth2client.model.AccessToken;

@Component
public class BearerTokenAttacher extends SchemeTokenAttacher {

    @Override
    public String getTokenType() {
        return AccessToken.BEARER_TOKEN_TYPE;
    }

    @Override
    protected String getScheme() {
        return "Bearer";
    }
}
