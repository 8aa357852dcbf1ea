package uz.greenwhite.oauth2client.attach;

import org.junit.jupiter.api.Test;
import uz.greenwhite.oauth2client.client.OutboundRequest;
import uz.greenwhite.oauth2client.exception.UnknownTokenTypeException;
import uz.greenwhite.oauth2client.model.AccessToken;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenAttacherRegistryTest {

    private final TokenAttacherRegistry registry = new TokenAttacherRegistry(
            List.of(new BearerTokenAttacher(), new Draft10TokenAttacher()));

    private final OutboundRequest request = OutboundRequest.builder()
            .url("http://localhost:18080/some-resource")
            .queryParams(Map.of("page", "1"))
            .build();

    @Test
    void bearerGoesToAuthorizationHeader() {
        AttachResult result = registry.attach(request, token("bearer", null));

        assertThat(result.attached()).isTrue();
        assertThat(result.request().getHeaders()).containsExactly(Map.entry("Authorization", "Bearer sesame"));
        assertThat(result.request().getQueryParams()).isEqualTo(Map.of("page", "1"));
    }

    @Test
    void bearerGoesToQueryParamWhenConfigured() {
        AttachResult result = registry.attach(request, token("bearer", "access_token"));

        assertThat(result.attached()).isTrue();
        assertThat(result.request().getQueryParams()).containsOnly(
                Map.entry("page", "1"), Map.entry("access_token", "sesame"));
        assertThat(result.request().getHeaders()).isEmpty();
    }

    @Test
    void tokenTypeIsCaseInsensitive() {
        AttachResult result = registry.attach(request, token("Bearer", null));

        assertThat(result.request().getHeaders()).containsEntry("Authorization", "Bearer sesame");
    }

    @Test
    void draft10UsesOAuthScheme() {
        AttachResult result = registry.attach(request, token(AccessToken.DRAFT_10_TOKEN_TYPE, null));

        assertThat(result.attached()).isTrue();
        assertThat(result.request().getHeaders()).containsExactly(Map.entry("Authorization", "OAuth sesame"));
    }

    @Test
    void missingAccessTokenLeavesRequestUnchanged() {
        AccessToken empty = AccessToken.builder().tokenType("bearer").build();

        AttachResult result = registry.attach(request, empty);

        assertThat(result.attached()).isFalse();
        assertThat(result.request()).isSameAs(request);
    }

    @Test
    void unknownTokenTypeIsSkippedUnlessStrict() {
        AccessToken mac = token("mac", null);

        AttachResult lenient = registry.attach(request, mac);
        assertThat(lenient.attached()).isFalse();
        assertThat(lenient.request()).isSameAs(request);

        OutboundRequest strict = request.toBuilder().throwExceptions(true).build();
        assertThatThrownBy(() -> registry.attach(strict, mac))
                .isInstanceOf(UnknownTokenTypeException.class)
                .hasMessage("Unknown token type: mac");
    }

    @Test
    void absentTokenIsUnknownType() {
        assertThat(registry.attach(request, null).attached()).isFalse();

        OutboundRequest strict = request.toBuilder().throwExceptions(true).build();
        assertThatThrownBy(() -> registry.attach(strict, null))
                .isInstanceOf(UnknownTokenTypeException.class);
    }

    @Test
    void withAccessTokenSetsQueryParam() {
        String uri = registry.withAccessToken("https://graph.example.com/me?fields=id", token("bearer", "access_token"));

        assertThat(uri).isEqualTo("https://graph.example.com/me?fields=id&access_token=sesame");
    }

    @Test
    void withAccessTokenEscapesPlusSign() {
        AccessToken token = token("bearer", "access_token").toBuilder().accessToken("a+b/c=").build();

        String uri = registry.withAccessToken("https://graph.example.com/me?fields=id%2Cname", token);

        assertThat(uri).isEqualTo("https://graph.example.com/me?fields=id%2Cname&access_token=a%2Bb%2Fc%3D");
    }

    private static AccessToken token(String tokenType, String queryParam) {
        return AccessToken.builder()
                .accessToken("sesame")
                .tokenType(tokenType)
                .queryParam(queryParam)
                .build();
    }
}
