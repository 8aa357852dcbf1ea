package uz.greenwhite.oauth2client.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uz.greenwhite.oauth2client.attach.TokenAttacherRegistry;
import uz.greenwhite.oauth2client.client.OAuth2RequestMiddleware;
import uz.greenwhite.oauth2client.client.ResourceResponse;
import uz.greenwhite.oauth2client.client.WebClientRequestExecutor;
import uz.greenwhite.oauth2client.metrics.OAuth2Metrics;

@Configuration
public class OAuth2ClientConfig {

    /**
     * WebClient execution decorated with the request's access token
     */
    @Bean
    public OAuth2RequestMiddleware<ResourceResponse> oauth2RequestExecutor(WebClientRequestExecutor webClientRequestExecutor,
                                                                          TokenAttacherRegistry tokenAttacherRegistry,
                                                                          OAuth2Metrics metrics) {
        return OAuth2RequestMiddleware.wrap(webClientRequestExecutor, tokenAttacherRegistry, metrics);
    }
}
