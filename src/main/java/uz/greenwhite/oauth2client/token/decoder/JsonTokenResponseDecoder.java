package uz.greenwhite.oauth2client.token.decoder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import uz.greenwhite.oauth2client.exception.OAuth2ProtocolException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class JsonTokenResponseDecoder implements TokenResponseDecoder {

    private final ObjectMapper objectMapper;

    /**
     * application/json, or text/javascript as sent by Facebook
     */
    @Override
    public boolean supports(String contentType) {
        return contentType != null
                && (contentType.startsWith("application/json") || contentType.startsWith("text/javascript"));
    }

    @Override
    public Map<String, Object> decode(String body) {
        if (body == null || body.isBlank()) {
            return Collections.emptyMap();
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Token response is not valid JSON: {}", e.getOriginalMessage());
            throw new OAuth2ProtocolException("Malformed JSON token response", INVALID_RESPONSE_CODE);
        }

        if (!json.isObject()) {
            throw new OAuth2ProtocolException("Token response is not a JSON object", INVALID_RESPONSE_CODE);
        }

        return toMap(json);
    }

    private static Map<String, Object> toMap(JsonNode object) {
        Map<String, Object> result = new LinkedHashMap<>();
        object.fields().forEachRemaining(entry -> {
            Object value = toValue(entry.getValue());
            if (value != null) {
                result.put(entry.getKey(), value);
            }
        });
        return result;
    }

    private static Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            return toMap(node);
        }
        if (node.isArray()) {
            List<Object> values = new ArrayList<>();
            node.forEach(element -> {
                Object value = toValue(element);
                if (value != null) {
                    values.add(value);
                }
            });
            return values;
        }
        return node.asText();
    }
}
