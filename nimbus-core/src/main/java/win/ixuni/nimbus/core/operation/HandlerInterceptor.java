package win.ixuni.nimbus.core.operation;

import reactor.core.publisher.Mono;

/**
 * Handler 拦截器
 * <p>
 * Wraps every handler execution of a driver. An interceptor either calls
 * {@code chain.proceed(operation, context)} and decorates the resulting {@link Mono}, or
 * answers on its own without proceeding.
 */
public interface HandlerInterceptor {

    <O extends Operation<R>, R> Mono<R> intercept(O operation, DriverContext context, InterceptorChain<O, R> chain);

    /**
     * Lower values wrap higher ones; 0 by default
     */
    default int getOrder() {
        return 0;
    }
}
