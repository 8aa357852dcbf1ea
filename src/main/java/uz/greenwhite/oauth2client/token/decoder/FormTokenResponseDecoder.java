package uz.greenwhite.oauth2client.token.decoder;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uz.greenwhite.oauth2client.exception.OAuth2ProtocolException;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * application/x-www-form-urlencoded bodies. Also the fallback for any
 * content type no other decoder claims (Facebook answers with text/plain).
 */
@Slf4j
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class FormTokenResponseDecoder implements TokenResponseDecoder {

    @Override
    public boolean supports(String contentType) {
        return true;
    }

    @Override
    public Map<String, Object> decode(String body) {
        if (body == null || body.isBlank()) {
            return Collections.emptyMap();
        }

        Map<String, Object> result = new LinkedHashMap<>();
        for (String pair : StringUtils.tokenizeToStringArray(body.trim(), "&")) {
            int idx = pair.indexOf('=');
            String name = idx < 0 ? pair : pair.substring(0, idx);
            String value = idx < 0 ? "" : pair.substring(idx + 1);
            result.putIfAbsent(urlDecode(name), urlDecode(value));
        }
        return result;
    }

    private static String urlDecode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // stray '%', typically an HTML page rather than a form body
            log.warn("Token response is not valid form data: {}", e.getMessage());
            throw new OAuth2ProtocolException("Malformed form token response", INVALID_RESPONSE_CODE);
        }
    }
}
