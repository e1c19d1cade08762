package win.ixuni.nimbus.driver.memory.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.operation.object.DeleteObjectOperation;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext;
import win.ixuni.nimbus.driver.memory.handler.AbstractMemoryHandler;

/**
 * Memory DeleteObject 处理器，删除不存在的 key 不报错
 */
public class MemoryDeleteObjectHandler extends AbstractMemoryHandler<DeleteObjectOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteObjectOperation operation, MemoryDriverContext context) {
        return context.requireBucket(operation.getBucketName())
                .doOnNext(bucket -> bucket.getObjects().remove(operation.getKey()))
                .then();
    }

    @Override
    public Class<DeleteObjectOperation> getOperationType() {
        return DeleteObjectOperation.class;
    }
}
