package win.ixuni.nimbus.driver.memory.handler;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.operation.DriverContext;
import win.ixuni.nimbus.core.operation.Operation;
import win.ixuni.nimbus.core.operation.OperationHandler;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;

/**
 * Memory Handler 抽象基类
 * <p>
 * 提供类型安全的 Context 访问，子类无需手动强制转换。
 *
 * @param <O> 操作类型
 * @param <R> 返回类型
 */
public abstract class AbstractMemoryHandler<O extends Operation<R>, R> implements OperationHandler<O, R> {

    @Override
    public final Mono<R> handle(O operation, DriverContext context) {
        if (!(context instanceof MemoryDriverContext memoryContext)) {
            return Mono.error(new IllegalArgumentException(
                    "Expected MemoryDriverContext but got: " + context.getClass().getName()));
        }
        return doHandle(operation, memoryContext);
    }

    /**
     * @param operation 操作
     * @param context   Memory 驱动上下文
     * @return operation result
     */
    protected abstract Mono<R> doHandle(O operation, MemoryDriverContext context);

    /**
     * Collect a content stream into a byte array; a null stream reads as empty
     */
    protected static Mono<byte[]> readFully(Flux<ByteBuffer> content) {
        if (content == null) {
            return Mono.just(new byte[0]);
        }
        return content
                .reduceWith(ByteArrayOutputStream::new, (out, buffer) -> {
                    ByteBuffer view = buffer.duplicate();
                    byte[] bytes = new byte[view.remaining()];
                    view.get(bytes);
                    out.write(bytes, 0, bytes.length);
                    return out;
                })
                .map(ByteArrayOutputStream::toByteArray);
    }
}
