package uz.greenwhite.oauth2client.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import uz.greenwhite.oauth2client.model.EndpointConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of oauth2.endpoints in application.yml
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class EndpointProperties {
    private String clientId;
    private String clientSecret;
    private String grantType;
    private String authorizationUri;
    private String accessTokenUri;
    private String redirectUri;
    @Builder.Default
    private List<String> scope = new ArrayList<>();
    private String accessQueryParam;
    private boolean authorizationHeader;
    private String accessType;
    @Builder.Default
    private List<String> prompt = new ArrayList<>();
    private String includeGrantedScopes;
    private String loginHint;

    public EndpointConfig toEndpointConfig() {
        return EndpointConfig.builder()
                .clientId(clientId)
                .clientSecret(clientSecret)
                .grantType(grantType)
                .authorizationUri(authorizationUri)
                .accessTokenUri(accessTokenUri)
                .redirectUri(redirectUri)
                .scope(scope == null || scope.isEmpty() ? null : List.copyOf(scope))
                .accessQueryParam(accessQueryParam)
                .authorizationHeader(authorizationHeader)
                .accessType(accessType)
                .prompt(prompt == null || prompt.isEmpty() ? null : List.copyOf(prompt))
                .includeGrantedScopes(includeGrantedScopes)
                .loginHint(loginHint)
                .build();
    }
}
