package win.ixuni.nimbus.core.operation;

import reactor.core.publisher.Mono;

/**
 * 操作处理器
 * <p>
 * A driver's implementation of one operation type.
 *
 * @param <O> operation type
 * @param <R> result type
 */
public interface OperationHandler<O extends Operation<R>, R> {

    Mono<R> handle(O operation, DriverContext context);

    /**
     * Key under which the handler is registered
     */
    Class<O> getOperationType();
}
