package uz.greenwhite.oauth2client.service;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uz.greenwhite.oauth2client.authorization.AuthorizationRequestBuilder;
import uz.greenwhite.oauth2client.client.OAuth2RequestMiddleware;
import uz.greenwhite.oauth2client.client.OutboundRequest;
import uz.greenwhite.oauth2client.client.ResourceResponse;
import uz.greenwhite.oauth2client.config.OAuth2Properties;
import uz.greenwhite.oauth2client.exception.OAuth2ConfigurationException;
import uz.greenwhite.oauth2client.grant.GrantStrategyRegistry;
import uz.greenwhite.oauth2client.model.AccessToken;
import uz.greenwhite.oauth2client.model.AuthRequest;
import uz.greenwhite.oauth2client.model.EndpointConfig;
import uz.greenwhite.oauth2client.token.AccessTokenService;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * OAuth2 operations addressed by configured endpoint name (oauth2.endpoints.*)
 */
@Slf4j
@Service
public class OAuth2ClientService {

    private final OAuth2Properties properties;
    private final AuthorizationRequestBuilder authorizationRequestBuilder;
    private final AccessTokenService accessTokenService;
    private final OAuth2RequestMiddleware<ResourceResponse> requestExecutor;

    @Getter
    private final Map<String, Object> information = new HashMap<>();

    public OAuth2ClientService(OAuth2Properties properties,
                               AuthorizationRequestBuilder authorizationRequestBuilder,
                               AccessTokenService accessTokenService,
                               OAuth2RequestMiddleware<ResourceResponse> requestExecutor,
                               GrantStrategyRegistry grantStrategyRegistry) {
        this.properties = properties;
        this.authorizationRequestBuilder = authorizationRequestBuilder;
        this.accessTokenService = accessTokenService;
        this.requestExecutor = requestExecutor;

        // Validate: every configured endpoint must use a registered grant type
        properties.getEndpointNames().forEach(name -> {
            String grantType = properties.getEndpointConfig(name).getGrantType();
            if (!grantStrategyRegistry.supports(grantType)) {
                throw new IllegalStateException(String.format(
                        "Invalid grant type '%s' for OAuth2 endpoint '%s'. Available types: %s",
                        grantType, name, grantStrategyRegistry.getGrantTypes()));
            }
        });

        this.information.put("endpoints", describeEndpoints());
        this.information.put("grantTypes", grantStrategyRegistry.getGrantTypes());
    }

    public AuthRequest authorize(String endpointName, String state) {
        return authorizationRequestBuilder.build(endpoint(endpointName), state);
    }

    public AccessToken getAccessToken(String endpointName, Map<String, String> params, AuthRequest expected) {
        return accessTokenService.getAccessToken(endpoint(endpointName), params, expected);
    }

    public Optional<AccessToken> refreshAccessToken(String endpointName, String refreshToken) {
        return accessTokenService.refreshAccessToken(refreshToken, endpoint(endpointName));
    }

    public ResourceResponse request(OutboundRequest request) {
        return requestExecutor.execute(request);
    }

    public EndpointConfig endpoint(String endpointName) {
        EndpointConfig config = properties.getEndpointConfig(endpointName);
        if (config == null) {
            throw new OAuth2ConfigurationException("OAuth2 endpoint not configured: " + endpointName);
        }
        return config;
    }

    private Map<String, Object> describeEndpoints() {
        Map<String, Object> endpoints = new LinkedHashMap<>();
        properties.getEndpointNames().forEach(name -> {
            EndpointConfig config = properties.getEndpointConfig(name);
            Map<String, Object> description = new LinkedHashMap<>();
            description.put("grantType", config.getGrantType());
            description.put("accessTokenUri", config.getAccessTokenUri());
            description.put("authorizationUri", config.getAuthorizationUri());
            description.put("scope", config.getScope());
            endpoints.put(name, description);
        });
        return endpoints;
    }
}
