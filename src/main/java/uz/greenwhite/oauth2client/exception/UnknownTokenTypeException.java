package uz.greenwhite.oauth2client.exception;

import lombok.Getter;

@Getter
public class UnknownTokenTypeException extends OAuth2Exception {

    private final String tokenType;

    public UnknownTokenTypeException(String tokenType) {
        super("Unknown token type: " + tokenType);
        this.tokenType = tokenType;
    }
}
