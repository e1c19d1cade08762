package win.ixuni.nimbus.driver.memory.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.exception.BucketNotEmptyException;
import win.ixuni.nimbus.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext;
import win.ixuni.nimbus.driver.memory.handler.AbstractMemoryHandler;

/**
 * Memory 删除 Bucket 处理器
 * <p>
 * Pending multipart uploads of the bucket are discarded with it.
 */
public class MemoryDeleteBucketHandler extends AbstractMemoryHandler<DeleteBucketOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteBucketOperation operation, MemoryDriverContext context) {
        String bucketName = operation.getBucketName();

        return context.requireBucket(bucketName)
                .flatMap(bucket -> {
                    if (!bucket.markRemovedIfEmpty()) {
                        return Mono.error(new BucketNotEmptyException(bucketName, bucket.getObjects().size()));
                    }
                    context.getBuckets().remove(bucketName, bucket);
                    context.getMultipartUploads().values()
                            .removeIf(upload -> bucketName.equals(upload.getBucketName()));
                    return Mono.empty();
                });
    }

    @Override
    public Class<DeleteBucketOperation> getOperationType() {
        return DeleteBucketOperation.class;
    }
}
