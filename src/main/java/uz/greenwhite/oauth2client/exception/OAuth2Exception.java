package uz.greenwhite.oauth2client.exception;

/**
 * Base type for every failure raised by the OAuth2 client.
 */
public class OAuth2Exception extends RuntimeException {

    public OAuth2Exception(String message) {
        super(message);
    }

    public OAuth2Exception(String message, Throwable cause) {
        super(message, cause);
    }
}
