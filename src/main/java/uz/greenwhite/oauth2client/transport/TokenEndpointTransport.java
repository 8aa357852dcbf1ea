package uz.greenwhite.oauth2client.transport;

import uz.greenwhite.oauth2client.token.TokenRequest;

import java.net.URI;

/**
 * Sends a form encoded POST to a token endpoint.
 * Implementations must return non-2xx answers instead of throwing,
 * and raise OAuth2TransportException when no answer was received.
 */
public interface TokenEndpointTransport {

    TokenHttpResponse post(URI uri, TokenRequest request);
}
