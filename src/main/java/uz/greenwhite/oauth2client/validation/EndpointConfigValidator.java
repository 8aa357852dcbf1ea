package uz.greenwhite.oauth2client.validation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.oauth2client.exception.OAuth2ConfigurationException;
import uz.greenwhite.oauth2client.model.EndpointConfig;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
public class EndpointConfigValidator {

    /**
     * Validate that the given fields are present on the endpoint configuration.
     * Returns list of missing field keys. Empty list means valid.
     */
    public List<String> validate(EndpointConfig config, EndpointField... required) {
        List<String> missing = new ArrayList<>();

        if (config == null) {
            missing.add("endpoint");
            return missing;
        }

        for (EndpointField field : required) {
            if (!field.isPresent(config)) {
                missing.add(field.getKey());
            }
        }

        return missing;
    }

    /**
     * Fail with OAuth2ConfigurationException unless every given field is present
     */
    public void require(EndpointConfig config, EndpointField... required) {
        List<String> missing = validate(config, required);
        if (!missing.isEmpty()) {
            log.debug("Endpoint configuration rejected, missing: {}", missing);
            throw new OAuth2ConfigurationException(
                    "Endpoint configuration is missing required fields: " + String.join(", ", missing),
                    missing);
        }
    }

    public boolean isValid(EndpointConfig config, EndpointField... required) {
        return validate(config, required).isEmpty();
    }
}
