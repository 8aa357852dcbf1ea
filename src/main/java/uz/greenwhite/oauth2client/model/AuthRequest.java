package uz.greenwhite.oauth2client.model;

import java.util.List;

/**
 * Authorization redirect built for the user agent.
 * Kept by the caller and passed back as the expected state when exchanging the code.
 */
public record AuthRequest(String uri, List<String> scope, String state) {

    public static AuthRequest expectingState(String state) {
        return new AuthRequest(null, List.of(), state);
    }
}
