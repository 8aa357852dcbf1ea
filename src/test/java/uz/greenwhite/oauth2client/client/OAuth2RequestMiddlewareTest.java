package uz.greenwhite.oauth2client.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import uz.greenwhite.oauth2client.OAuth2Fixtures;
import uz.greenwhite.oauth2client.attach.BearerTokenAttacher;
import uz.greenwhite.oauth2client.attach.Draft10TokenAttacher;
import uz.greenwhite.oauth2client.attach.TokenAttacherRegistry;
import uz.greenwhite.oauth2client.exception.OAuth2ProtocolException;
import uz.greenwhite.oauth2client.metrics.OAuth2Metrics;
import uz.greenwhite.oauth2client.model.AccessToken;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OAuth2RequestMiddlewareTest {

    private static final ResourceResponse OK = new ResourceResponse(200, HttpHeaders.EMPTY, "{}");

    @Mock
    private RequestExecutor<ResourceResponse> delegate;

    @Captor
    private ArgumentCaptor<OutboundRequest> requestCaptor;

    private OAuth2Metrics metrics;
    private OAuth2RequestMiddleware<ResourceResponse> middleware;

    @BeforeEach
    void setUp() {
        metrics = OAuth2Fixtures.metrics();
        middleware = OAuth2RequestMiddleware.wrap(delegate,
                new TokenAttacherRegistry(List.of(new BearerTokenAttacher(), new Draft10TokenAttacher())),
                metrics);
    }

    @Test
    void attachesTokenAndStripsOAuth2Field() {
        when(delegate.execute(any())).thenReturn(OK);
        OutboundRequest request = OutboundRequest.builder()
                .url("http://localhost:18080/some-resource")
                .oauth2(OAuth2Fixtures.DEFAULT_TOKEN.toBuilder().queryParam(null).build())
                .build();

        assertThat(middleware.execute(request)).isSameAs(OK);

        verify(delegate).execute(requestCaptor.capture());
        OutboundRequest sent = requestCaptor.getValue();
        assertThat(sent.getOauth2()).isNull();
        assertThat(sent.getHeaders()).containsEntry("Authorization", "Bearer sesame");
        assertThat(metrics.getTokenAttached().count()).isEqualTo(1.0);
    }

    @Test
    void forwardsUnauthenticatedWhenLenient() {
        when(delegate.execute(any())).thenReturn(OK);
        OutboundRequest request = OutboundRequest.builder()
                .url("http://localhost:18080/public")
                .oauth2(AccessToken.builder().tokenType("bearer").build())
                .build();

        middleware.execute(request);

        verify(delegate).execute(requestCaptor.capture());
        assertThat(requestCaptor.getValue().getHeaders()).isEmpty();
        assertThat(requestCaptor.getValue().getOauth2()).isNull();
        assertThat(metrics.getTokenSkipped().count()).isEqualTo(1.0);
    }

    @Test
    void missingAccessTokenFailsWhenStrict() {
        OutboundRequest request = OutboundRequest.builder()
                .url("http://localhost:18080/some-resource")
                .throwExceptions(true)
                .oauth2(AccessToken.builder().tokenType("bearer").build())
                .build();

        assertThatThrownBy(() -> middleware.execute(request))
                .isInstanceOf(OAuth2ProtocolException.class)
                .hasMessage(OAuth2RequestMiddleware.MISSING_PARAMS_MESSAGE);
        verifyNoInteractions(delegate);
    }
}
