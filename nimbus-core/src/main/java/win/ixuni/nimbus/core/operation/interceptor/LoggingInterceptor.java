package win.ixuni.nimbus.core.operation.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.exception.NimbusException;
import win.ixuni.nimbus.core.operation.DriverContext;
import win.ixuni.nimbus.core.operation.HandlerInterceptor;
import win.ixuni.nimbus.core.operation.InterceptorChain;
import win.ixuni.nimbus.core.operation.Operation;

/**
 * 日志拦截器
 * <p>
 * Logs each operation with the resource it addresses and its duration. Client errors
 * (4xx, e.g. NoSuchKey) go to debug since callers probe with them; everything else to warn.
 */
@Slf4j
public class LoggingInterceptor implements HandlerInterceptor {

    public static final int ORDER = -100;

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(O operation, DriverContext context,
                                                        InterceptorChain<O, R> chain) {
        String driverName = context.getDriverName();
        String description = operation.getOperationName() + " " + operation.getResource();

        return Mono.defer(() -> {
            long start = System.nanoTime();
            log.debug("[{}] {} started", driverName, description);

            return chain.proceed(operation, context)
                    .doOnSuccess(result -> log.debug("[{}] {} completed in {}ms",
                            driverName, description, elapsedMillis(start)))
                    .doOnError(error -> {
                        if (error instanceof NimbusException storageError && storageError.getHttpStatus() < 500) {
                            log.debug("[{}] {} rejected after {}ms: {}",
                                    driverName, description, elapsedMillis(start), storageError.getErrorCode());
                        } else {
                            log.warn("[{}] {} failed after {}ms: {}",
                                    driverName, description, elapsedMillis(start), error.toString());
                        }
                    });
        });
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    @Override
    public int getOrder() {
        return ORDER;
    }
}
