package uz.greenwhite.oauth2client.model;

import lombok.Builder;

import java.util.Map;

/**
 * Token obtained from the token endpoint. Opaque to the client once returned.
 *
 * @param accessToken  the access token
 * @param tokenType    token type as reported by the provider, or {@link #DRAFT_10_TOKEN_TYPE}
 * @param queryParam   query parameter carrying the token, null to use the Authorization header
 * @param refreshToken refresh token, may be null
 * @param params       remaining provider fields except access_token and token_type
 */
@Builder(toBuilder = true)
public record AccessToken(String accessToken,
                          String tokenType,
                          String queryParam,
                          String refreshToken,
                          Map<String, Object> params) {

    public static final String BEARER_TOKEN_TYPE = "bearer";

    /**
     * Legacy providers (Force.com) omit token_type and expect the pre-RFC "OAuth" scheme.
     * Used whenever the token response carries no token_type.
     */
    public static final String DRAFT_10_TOKEN_TYPE = "draft-10";

    public AccessToken {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public boolean hasAccessToken() {
        return accessToken != null && !accessToken.isEmpty();
    }
}
