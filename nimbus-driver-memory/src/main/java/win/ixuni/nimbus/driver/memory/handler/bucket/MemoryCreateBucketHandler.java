package win.ixuni.nimbus.driver.memory.handler.bucket;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.exception.BucketAlreadyExistsException;
import win.ixuni.nimbus.core.exception.InvalidBucketNameException;
import win.ixuni.nimbus.core.model.StorageBucket;
import win.ixuni.nimbus.core.operation.bucket.CreateBucketOperation;
import win.ixuni.nimbus.core.util.BucketNameValidator;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext.BucketInfo;
import win.ixuni.nimbus.driver.memory.handler.AbstractMemoryHandler;

/**
 * Memory 创建 Bucket 处理器
 * <p>
 * Creating an existing bucket returns it unchanged unless the driver runs with strict-create.
 */
@Slf4j
public class MemoryCreateBucketHandler extends AbstractMemoryHandler<CreateBucketOperation, StorageBucket> {

    @Override
    protected Mono<StorageBucket> doHandle(CreateBucketOperation operation, MemoryDriverContext context) {
        String bucketName = operation.getBucketName();
        String violation = BucketNameValidator.violation(bucketName);
        if (violation != null) {
            return Mono.error(new InvalidBucketNameException(bucketName, violation));
        }

        BucketInfo candidate = BucketInfo.builder()
                .name(bucketName)
                .creationDate(MemoryDriverContext.now())
                .cannedAcl(operation.getCannedAcl())
                .build();
        BucketInfo existing = context.getBuckets().putIfAbsent(bucketName, candidate);

        if (existing != null) {
            if (context.isStrictCreate()) {
                return Mono.error(new BucketAlreadyExistsException(bucketName));
            }
            log.debug("Bucket {} already exists, create is a no-op", bucketName);
            return Mono.just(toModel(existing, context));
        }
        return Mono.just(toModel(candidate, context));
    }

    private StorageBucket toModel(BucketInfo bucket, MemoryDriverContext context) {
        return StorageBucket.builder()
                .name(bucket.getName())
                .creationDate(bucket.getCreationDate())
                .cannedAcl(bucket.getCannedAcl())
                .driverName(context.getDriverName())
                .build();
    }

    @Override
    public Class<CreateBucketOperation> getOperationType() {
        return CreateBucketOperation.class;
    }
}
