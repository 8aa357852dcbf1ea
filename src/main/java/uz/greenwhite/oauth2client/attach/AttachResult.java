package uz.greenwhite.oauth2client.attach;

import uz.greenwhite.oauth2client.client.OutboundRequest;

/**
 * @param request  the request, decorated when attached is true, unchanged otherwise
 * @param attached whether an access token was placed on the request
 */
public record AttachResult(OutboundRequest request, boolean attached) {

    public static AttachResult attached(OutboundRequest request) {
        return new AttachResult(request, true);
    }

    public static AttachResult unchanged(OutboundRequest request) {
        return new AttachResult(request, false);
    }
}
