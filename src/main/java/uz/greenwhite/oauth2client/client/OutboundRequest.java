package uz.greenwhite.oauth2client.client;

import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpMethod;
import uz.greenwhite.oauth2client.model.AccessToken;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request to a protected resource. The oauth2 field carries the token to attach;
 * it is removed before the request leaves the middleware.
 */
@Value
@Builder(toBuilder = true)
public class OutboundRequest {

    @Builder.Default
    HttpMethod method = HttpMethod.GET;

    String url;

    @Builder.Default
    Map<String, String> headers = Collections.emptyMap();

    @Builder.Default
    Map<String, String> queryParams = Collections.emptyMap();

    String body;

    /**
     * Fail instead of sending the request unauthenticated, and fail on error statuses
     */
    boolean throwExceptions;

    AccessToken oauth2;

    public OutboundRequest withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return toBuilder().headers(Collections.unmodifiableMap(copy)).build();
    }

    public OutboundRequest withQueryParam(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(queryParams);
        copy.put(name, value);
        return toBuilder().queryParams(Collections.unmodifiableMap(copy)).build();
    }

    public OutboundRequest withoutOAuth2() {
        return toBuilder().oauth2(null).build();
    }
}
