package win.ixuni.nimbus.core.operation;

import reactor.core.publisher.Mono;

/**
 * The rest of an interceptor chain; the last link calls the handler itself.
 */
@FunctionalInterface
public interface InterceptorChain<O extends Operation<R>, R> {

    Mono<R> proceed(O operation, DriverContext context);
}
