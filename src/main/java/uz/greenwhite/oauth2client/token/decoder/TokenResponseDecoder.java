package uz.greenwhite.oauth2client.token.decoder;

import java.util.Map;

/**
 * Interprets a token endpoint response body.
 * Scalars are decoded as strings so JSON and form responses yield the same values.
 */
public interface TokenResponseDecoder {

    /**
     * Code of the protocol error raised for a body the decoder cannot read
     */
    String INVALID_RESPONSE_CODE = "invalid_response";

    /**
     * @param contentType value of the content-type response header, may be null
     */
    boolean supports(String contentType);

    /**
     * @throws uz.greenwhite.oauth2client.exception.OAuth2ProtocolException with {@link #INVALID_RESPONSE_CODE}
     *                                                                      when the body is malformed
     */
    Map<String, Object> decode(String body);
}
