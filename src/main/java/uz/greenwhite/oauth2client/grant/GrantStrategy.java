package uz.greenwhite.oauth2client.grant;

import uz.greenwhite.oauth2client.model.EndpointConfig;
import uz.greenwhite.oauth2client.token.TokenRequest;

import java.util.Map;

public interface GrantStrategy {

    /**
     * Grant type name — must match the "grant-type" of the endpoint
     * Example: "authorization_code", "password"
     */
    String getName();

    /**
     * Add the grant specific fields to the token request body
     */
    void prepare(TokenRequest request, EndpointConfig config, Map<String, String> params);
}
