package win.ixuni.nimbus.core.driver;

import lombok.Getter;
import win.ixuni.nimbus.core.operation.OperationHandlerRegistry;
import win.ixuni.nimbus.core.operation.interceptor.LoggingInterceptor;

/**
 * Abstract base class for storage drivers
 * <p>
 * Owns the handler registry and installs the logging interceptor; subclasses register their
 * handlers and provide a context.
 */
public abstract class AbstractStorageDriver implements StorageDriver {

    @Getter
    protected final OperationHandlerRegistry handlerRegistry = new OperationHandlerRegistry();

    protected AbstractStorageDriver() {
        handlerRegistry.addInterceptor(new LoggingInterceptor());
    }
}
