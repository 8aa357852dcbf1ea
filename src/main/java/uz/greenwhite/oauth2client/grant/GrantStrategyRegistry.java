package uz.greenwhite.oauth2client.grant;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.oauth2client.exception.OAuth2ConfigurationException;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Grant type name → strategy. Every GrantStrategy bean is registered,
 * so a new grant type only needs a new bean.
 */
@Slf4j
@Component
public class GrantStrategyRegistry {

    private final Map<String, GrantStrategy> strategies;

    @Getter
    private final Set<String> grantTypes;

    public GrantStrategyRegistry(List<GrantStrategy> strategies) {
        this.strategies = strategies.stream()
                .collect(Collectors.toUnmodifiableMap(GrantStrategy::getName, Function.identity()));
        this.grantTypes = this.strategies.keySet();

        log.info("OAuth2 grant types registered: {}", grantTypes);
    }

    public GrantStrategy get(String grantType) {
        GrantStrategy strategy = grantType == null ? null : strategies.get(grantType);
        if (strategy == null) {
            throw new OAuth2ConfigurationException(
                    String.format("Unsupported grant type '%s'. Available types: %s", grantType, grantTypes));
        }
        return strategy;
    }

    public boolean supports(String grantType) {
        return grantType != null && strategies.containsKey(grantType);
    }
}
