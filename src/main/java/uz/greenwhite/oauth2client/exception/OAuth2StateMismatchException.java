package uz.greenwhite.oauth2client.exception;

import lombok.Getter;

/**
 * The {@code state} returned on the redirect callback differs from the one sent.
 */
@Getter
public class OAuth2StateMismatchException extends OAuth2Exception {

    private final String expected;
    private final String actual;

    public OAuth2StateMismatchException(String expected, String actual) {
        super(String.format("Expected state %s but got %s", expected, actual));
        this.expected = expected;
        this.actual = actual;
    }
}
