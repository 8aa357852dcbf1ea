package uz.greenwhite.oauth2client.exception;

/**
 * The token endpoint could not be reached or did not answer within the fixed timeouts.
 */
public class OAuth2TransportException extends OAuth2Exception {

    public OAuth2TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
