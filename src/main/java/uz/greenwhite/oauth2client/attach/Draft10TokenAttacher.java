package uz.greenwhite.oauth2client.attach;

import org.springframework.stereotype.Component;
import uz.greenwhite.oauth2client.model.AccessToken;

/**
 * OAuth2 draft 10 convention still used by Force.com: "Authorization: OAuth token"
 */
@Component
public class Draft10TokenAttacher extends SchemeTokenAttacher {

    @Override
    public String getTokenType() {
        return AccessToken.DRAFT_10_TOKEN_TYPE;
    }

    @Override
    protected String getScheme() {
        return "OAuth";
    }
}
