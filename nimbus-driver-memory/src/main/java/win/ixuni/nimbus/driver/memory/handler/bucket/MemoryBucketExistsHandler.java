package win.ixuni.nimbus.driver.memory.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.operation.bucket.BucketExistsOperation;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext;
import win.ixuni.nimbus.driver.memory.handler.AbstractMemoryHandler;

/**
 * Memory Bucket 存在性检查处理器
 */
public class MemoryBucketExistsHandler extends AbstractMemoryHandler<BucketExistsOperation, Boolean> {

    @Override
    protected Mono<Boolean> doHandle(BucketExistsOperation operation, MemoryDriverContext context) {
        String bucketName = operation.getBucketName();
        return Mono.just(bucketName != null && context.getBuckets().containsKey(bucketName));
    }

    @Override
    public Class<BucketExistsOperation> getOperationType() {
        return BucketExistsOperation.class;
    }
}
