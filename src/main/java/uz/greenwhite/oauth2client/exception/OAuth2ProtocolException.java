package uz.greenwhite.oauth2client.exception;

import lombok.Getter;

/**
 * The authorization or token server reported a failure, or a request lacked
 * a usable token when one was required.
 */
@Getter
public class OAuth2ProtocolException extends OAuth2Exception {

    public static final String UNKNOWN_CODE = "unknown";

    private final String code;

    public OAuth2ProtocolException(String message, String code) {
        super(message);
        this.code = code;
    }

    public OAuth2ProtocolException(String message) {
        this(message, UNKNOWN_CODE);
    }
}
