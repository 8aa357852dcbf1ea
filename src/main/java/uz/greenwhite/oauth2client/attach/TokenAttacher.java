package uz.greenwhite.oauth2client.attach;

import uz.greenwhite.oauth2client.client.OutboundRequest;
import uz.greenwhite.oauth2client.model.AccessToken;

public interface TokenAttacher {

    /**
     * Lower-case token type this attacher handles, e.g. "bearer"
     */
    String getTokenType();

    AttachResult attach(OutboundRequest request, AccessToken token);
}
