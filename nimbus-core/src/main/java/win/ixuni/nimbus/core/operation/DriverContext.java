package win.ixuni.nimbus.core.operation;

import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.config.DriverConfig;

/**
 * 驱动上下文
 * <p>
 * What a driver's handlers share: configuration, storage state (in the implementation) and
 * the registry, through which one handler can run another operation of the same driver.
 */
public interface DriverContext {

    DriverConfig getConfig();

    String getDriverName();

    String getDriverType();

    OperationHandlerRegistry getHandlerRegistry();

    /**
     * Set once by the driver after its handlers are registered
     */
    void setHandlerRegistry(OperationHandlerRegistry registry);

    /**
     * Run another operation of this driver, through the full interceptor chain
     */
    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, this);
    }
}
