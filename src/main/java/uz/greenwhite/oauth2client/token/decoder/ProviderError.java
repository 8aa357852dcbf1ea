package uz.greenwhite.oauth2client.token.decoder;

import uz.greenwhite.oauth2client.exception.OAuth2ProtocolException;

import java.util.Map;
import java.util.Optional;

/**
 * Error reported in a token response. Providers use one of two shapes:
 * <pre>
 *   STANDARD: {"error": "invalid_grant", "error_description": "..."}
 *   FACEBOOK: {"error": {"type": "OAuthException", "message": "..."}}
 * </pre>
 *
 * @param shape   which of the two shapes the body used, NONE when only the status signalled failure
 * @param code    error code (error, or error.type)
 * @param message human readable message (error_description, or error.message)
 */
public record ProviderError(Shape shape, String code, String message) {

    public static final String GENERIC_MESSAGE = "error requesting access token";

    public enum Shape {
        STANDARD,
        FACEBOOK,
        NONE
    }

    /**
     * Resolve the error carried by a decoded body, if any
     */
    public static Optional<ProviderError> from(Map<String, ?> body) {
        Object error = body.get("error");
        if (error == null) {
            return Optional.empty();
        }

        if (error instanceof Map<?, ?> nested) {
            return Optional.of(new ProviderError(Shape.FACEBOOK,
                    asString(nested.get("type")),
                    asString(nested.get("message"))));
        }

        return Optional.of(new ProviderError(Shape.STANDARD,
                error.toString(),
                asString(body.get("error_description"))));
    }

    /**
     * Failure signalled only by a non-200 status
     */
    public static ProviderError unknown() {
        return new ProviderError(Shape.NONE, OAuth2ProtocolException.UNKNOWN_CODE, GENERIC_MESSAGE);
    }

    public OAuth2ProtocolException toException() {
        return new OAuth2ProtocolException(message, code);
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
