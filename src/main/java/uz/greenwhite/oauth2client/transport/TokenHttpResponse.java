package uz.greenwhite.oauth2client.transport;

import org.springframework.http.HttpHeaders;

/**
 * Raw answer of the token endpoint, whatever its status.
 */
public record TokenHttpResponse(int status, HttpHeaders headers, String body) {

    public TokenHttpResponse {
        headers = headers == null ? HttpHeaders.EMPTY : HttpHeaders.readOnlyHttpHeaders(headers);
    }

    public String contentType() {
        return headers.getFirst(HttpHeaders.CONTENT_TYPE);
    }

    public boolean isOk() {
        return status == 200;
    }
}
