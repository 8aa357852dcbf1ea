package uz.greenwhite.oauth2client.exception;

import lombok.Getter;

import java.util.List;

/**
 * A field required by the attempted operation is missing from the endpoint configuration.
 * Always raised before any network call.
 */
@Getter
public class OAuth2ConfigurationException extends OAuth2Exception {

    private final List<String> missingFields;

    public OAuth2ConfigurationException(String message) {
        super(message);
        this.missingFields = List.of();
    }

    public OAuth2ConfigurationException(String message, List<String> missingFields) {
        super(message);
        this.missingFields = List.copyOf(missingFields);
    }
}
