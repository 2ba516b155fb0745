package io.hermes.server.dispatch;

/**
 * A step of the dispatcher's interceptor chain, run in order before the handler.
 * <p>
 * An interceptor aborts the request by throwing an {@link io.hermes.spec.A2AError}; the handler is
 * then never invoked.
 */
@FunctionalInterface
public interface MethodInterceptor {

    void beforeInvoke(RequestContext context);
}
