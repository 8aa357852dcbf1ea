package uz.greenwhite.oauth2client.attach;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.oauth2client.client.OutboundRequest;
import uz.greenwhite.oauth2client.exception.UnknownTokenTypeException;
import uz.greenwhite.oauth2client.model.AccessToken;
import uz.greenwhite.oauth2client.util.QueryParams;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lower-cased token type → attacher. Unknown or absent types fall through to
 * {@link #attachUnknown}, which fails only for requests that ask for it.
 */
@Slf4j
@Component
public class TokenAttacherRegistry {

    private final Map<String, TokenAttacher> attachers;

    public TokenAttacherRegistry(List<TokenAttacher> attachers) {
        this.attachers = attachers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        attacher -> attacher.getTokenType().toLowerCase(Locale.ROOT),
                        Function.identity()));

        log.info("OAuth2 token types registered: {}", this.attachers.keySet());
    }

    public AttachResult attach(OutboundRequest request, AccessToken token) {
        String tokenType = token == null ? null : token.tokenType();
        TokenAttacher attacher = tokenType == null ? null : attachers.get(tokenType.toLowerCase(Locale.ROOT));

        if (attacher == null) {
            return attachUnknown(request, tokenType);
        }
        return attacher.attach(request, token);
    }

    /**
     * Append the access token to a URI as its query parameter
     */
    public String withAccessToken(String uri, AccessToken token) {
        if (token.queryParam() == null) {
            throw new IllegalArgumentException("Access token has no query parameter configured");
        }
        return QueryParams.set(uri, token.queryParam(), token.accessToken());
    }

    private AttachResult attachUnknown(OutboundRequest request, String tokenType) {
        if (request.isThrowExceptions()) {
            throw new UnknownTokenTypeException(tokenType);
        }
        log.debug("Token type '{}' not supported, request left unchanged", tokenType);
        return AttachResult.unchanged(request);
    }
}
