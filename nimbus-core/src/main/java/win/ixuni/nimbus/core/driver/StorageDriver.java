package win.ixuni.nimbus.core.driver;

import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.operation.DriverContext;
import win.ixuni.nimbus.core.operation.Operation;
import win.ixuni.nimbus.core.operation.OperationHandlerRegistry;

/**
 * Storage driver interface
 * <p>
 * All storage operations go through {@link #execute(Operation)}; each driver registers its own
 * handlers with the registry.
 */
public interface StorageDriver {

    OperationHandlerRegistry getHandlerRegistry();

    DriverContext getDriverContext();

    /**
     * Execute an operation
     * <p>
     * Unified entry point for all storage operations, with interceptor chain support.
     *
     * @param operation the operation instance
     * @param <O>       operation type
     * @param <R>       return type
     * @return operation result
     */
    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, getDriverContext());
    }

    /**
     * @return driver type (e.g. "memory")
     */
    String getDriverType();

    /**
     * @return instance name as given in configuration
     */
    String getDriverName();

    default Mono<Void> initialize() {
        return Mono.empty();
    }

    default Mono<Void> shutdown() {
        return Mono.empty();
    }
}
