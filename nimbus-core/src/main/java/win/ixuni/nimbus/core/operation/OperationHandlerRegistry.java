package win.ixuni.nimbus.core.operation;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 操作处理器注册表
 * <p>
 * One handler per operation class, registered while the driver is constructed. Every
 * {@link #execute} runs the handler inside the interceptor chain, lowest order outermost.
 */
@Slf4j
public class OperationHandlerRegistry {

    private final Map<Class<?>, OperationHandler<?, ?>> handlers = new ConcurrentHashMap<>();

    /**
     * Sorted by order; replaced as a whole on every change
     */
    private volatile List<HandlerInterceptor> interceptors = List.of();

    /**
     * @throws IllegalStateException when the operation already has a handler
     */
    public <O extends Operation<R>, R> void register(OperationHandler<O, R> handler) {
        Class<O> operationType = handler.getOperationType();
        OperationHandler<?, ?> previous = handlers.putIfAbsent(operationType, handler);
        if (previous != null) {
            throw new IllegalStateException("Operation " + operationType.getSimpleName()
                    + " already handled by " + previous.getClass().getSimpleName());
        }
        log.debug("Registered {} for {}", handler.getClass().getSimpleName(), operationType.getSimpleName());
    }

    public synchronized void addInterceptor(HandlerInterceptor interceptor) {
        List<HandlerInterceptor> sorted = new ArrayList<>(interceptors);
        sorted.add(interceptor);
        sorted.sort(Comparator.comparingInt(HandlerInterceptor::getOrder));
        interceptors = List.copyOf(sorted);
        log.debug("Added interceptor {} (order {})", interceptor.getClass().getSimpleName(), interceptor.getOrder());
    }

    /**
     * Run an operation through the interceptors and its handler
     *
     * @return the handler's result, or {@link UnsupportedOperationException} when the
     * operation has no handler
     */
    @SuppressWarnings("unchecked")
    public <O extends Operation<R>, R> Mono<R> execute(O operation, DriverContext context) {
        OperationHandler<O, R> handler = (OperationHandler<O, R>) handlers.get(operation.getClass());
        if (handler == null) {
            return Mono.error(new UnsupportedOperationException(
                    "No handler registered for operation: " + operation.getOperationName()));
        }

        InterceptorChain<O, R> chain = handler::handle;
        List<HandlerInterceptor> snapshot = interceptors;
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            HandlerInterceptor interceptor = snapshot.get(i);
            InterceptorChain<O, R> next = chain;
            chain = (op, ctx) -> interceptor.intercept(op, ctx, next);
        }
        return chain.proceed(operation, context);
    }

    public boolean supports(Class<? extends Operation<?>> operationType) {
        return handlers.containsKey(operationType);
    }

    public int size() {
        return handlers.size();
    }

    public int interceptorCount() {
        return interceptors.size();
    }
}
