package uz.greenwhite.oauth2client.client;

import lombok.extern.slf4j.Slf4j;
import uz.greenwhite.oauth2client.attach.AttachResult;
import uz.greenwhite.oauth2client.attach.TokenAttacherRegistry;
import uz.greenwhite.oauth2client.exception.OAuth2ProtocolException;
import uz.greenwhite.oauth2client.metrics.OAuth2Metrics;

/**
 * Wraps a request executor so every call carries the access token found in the request's oauth2 field.
 */
@Slf4j
public class OAuth2RequestMiddleware<R> implements RequestExecutor<R> {

    public static final String MISSING_PARAMS_MESSAGE = "Missing oauth2 params";

    private final RequestExecutor<R> delegate;
    private final TokenAttacherRegistry attachers;
    private final OAuth2Metrics metrics;

    public OAuth2RequestMiddleware(RequestExecutor<R> delegate,
                                   TokenAttacherRegistry attachers,
                                   OAuth2Metrics metrics) {
        this.delegate = delegate;
        this.attachers = attachers;
        this.metrics = metrics;
    }

    public static <R> OAuth2RequestMiddleware<R> wrap(RequestExecutor<R> delegate,
                                                      TokenAttacherRegistry attachers,
                                                      OAuth2Metrics metrics) {
        return new OAuth2RequestMiddleware<>(delegate, attachers, metrics);
    }

    @Override
    public R execute(OutboundRequest request) {
        AttachResult result = attachers.attach(request, request.getOauth2());
        OutboundRequest stripped = result.request().withoutOAuth2();

        if (result.attached()) {
            metrics.getTokenAttached().increment();
            return delegate.execute(stripped);
        }

        metrics.getTokenSkipped().increment();
        if (request.isThrowExceptions()) {
            throw new OAuth2ProtocolException(MISSING_PARAMS_MESSAGE);
        }

        log.debug("No access token attached, sending {} {} unauthenticated", request.getMethod(), request.getUrl());
        return delegate.execute(stripped);
    }
}
