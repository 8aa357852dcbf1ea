package uz.greenwhite.oauth2client.attach;

import org.springframework.http.HttpHeaders;
import uz.greenwhite.oauth2client.client.OutboundRequest;
import uz.greenwhite.oauth2client.model.AccessToken;

/**
 * Places the token in the configured query parameter, or else in an
 * Authorization header using the attacher's scheme.
 */
public abstract class SchemeTokenAttacher implements TokenAttacher {

    protected abstract String getScheme();

    @Override
    public AttachResult attach(OutboundRequest request, AccessToken token) {
        if (token == null || !token.hasAccessToken()) {
            return AttachResult.unchanged(request);
        }

        if (token.queryParam() != null) {
            return AttachResult.attached(request.withQueryParam(token.queryParam(), token.accessToken()));
        }

        return AttachResult.attached(
                request.withHeader(HttpHeaders.AUTHORIZATION, getScheme() + " " + token.accessToken()));
    }
}
