package uz.greenwhite.oauth2client.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import uz.greenwhite.oauth2client.model.EndpointConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "oauth2")
public class OAuth2Properties {

    private Map<String, EndpointProperties> endpoints = new LinkedHashMap<>();

    @PostConstruct
    void init() {
        if (endpoints == null || endpoints.isEmpty()) {
            log.info("No OAuth2 endpoints configured");
            return;
        }

        endpoints.forEach((name, endpoint) -> {
            if (endpoint.getClientId() == null || endpoint.getGrantType() == null) {
                throw new IllegalArgumentException(String.format(
                        "OAuth2 endpoint '%s' must define client-id and grant-type", name));
            }
        });

        log.info("OAuth2 endpoints configured: {}", endpoints.keySet());
    }

    public EndpointConfig getEndpointConfig(String name) {
        if (endpoints == null) return null;
        EndpointProperties properties = endpoints.get(name);
        return properties == null ? null : properties.toEndpointConfig();
    }

    public Set<String> getEndpointNames() {
        return endpoints == null ? Collections.emptySet() : endpoints.keySet();
    }
}
