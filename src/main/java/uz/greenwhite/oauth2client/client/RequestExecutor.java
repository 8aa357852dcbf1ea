package uz.greenwhite.oauth2client.client;

/**
 * Executes a request against a protected resource.
 *
 * @param <R> response type
 */
@FunctionalInterface
public interface RequestExecutor<R> {

    R execute(OutboundRequest request);
}
