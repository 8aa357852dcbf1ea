package uz.greenwhite.oauth2client.token;

import lombok.Getter;
import lombok.ToString;
import org.springframework.http.MediaType;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token endpoint request under construction. Grant strategies and client
 * authenticators add their fields before it is handed to the transport.
 */
@Getter
@ToString(exclude = {"headers", "form"})
public class TokenRequest {

    public static final String GRANT_TYPE = "grant_type";

    private final String contentType = MediaType.APPLICATION_FORM_URLENCODED_VALUE;
    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private final Map<String, String> form = new LinkedHashMap<>();

    public TokenRequest(String grantType, Duration connectTimeout, Duration readTimeout) {
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
        addFormField(GRANT_TYPE, grantType);
    }

    public TokenRequest header(String name, String value) {
        headers.put(name, value);
        return this;
    }

    /**
     * Null values are left out of the body
     */
    public TokenRequest addFormField(String name, String value) {
        if (value != null) {
            form.put(name, value);
        }
        return this;
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public Map<String, String> getForm() {
        return Collections.unmodifiableMap(form);
    }
}
