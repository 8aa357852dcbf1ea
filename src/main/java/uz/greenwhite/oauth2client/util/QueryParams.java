package uz.greenwhite.oauth2client.util;

import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sets query parameters on a URI string.
 * <p>
 * Names and values go through URI template variables, so they are encoded strictly:
 * every reserved character is escaped, including '+', which form decoders read as a space.
 * The existing query is decoded first and re-encoded the same way.
 */
public final class QueryParams {

    private QueryParams() {
    }

    /**
     * Replace (or add) the given parameters. Null values are skipped.
     */
    public static String set(String uri, Map<String, String> params) {
        UriComponents original = UriComponentsBuilder.fromUriString(uri).build();

        Map<String, List<String>> query = new LinkedHashMap<>();
        original.getQueryParams().forEach((name, values) -> {
            List<String> decoded = new ArrayList<>();
            values.forEach(value -> decoded.add(value == null ? null : decode(value)));
            query.put(decode(name), decoded);
        });
        params.forEach((name, value) -> {
            if (value != null) {
                query.put(name, List.of(value));
            }
        });

        UriComponentsBuilder builder = UriComponentsBuilder.newInstance()
                .uriComponents(original)
                .replaceQuery(null);

        Map<String, Object> variables = new HashMap<>();
        query.forEach((name, values) -> {
            String nameVar = variable(variables, name);
            if (values.isEmpty() || values.equals(Collections.singletonList(null))) {
                builder.queryParam(nameVar);
                return;
            }
            values.forEach(value -> builder.queryParam(nameVar,
                    value == null ? null : variable(variables, value)));
        });

        return builder.encode().buildAndExpand(variables).toUriString();
    }

    public static String set(String uri, String name, String value) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put(name, value);
        return set(uri, params);
    }

    private static String variable(Map<String, Object> variables, String value) {
        String key = "q" + variables.size();
        variables.put(key, value);
        return "{" + key + "}";
    }

    private static String decode(String value) {
        return UriUtils.decode(value, StandardCharsets.UTF_8);
    }
}
