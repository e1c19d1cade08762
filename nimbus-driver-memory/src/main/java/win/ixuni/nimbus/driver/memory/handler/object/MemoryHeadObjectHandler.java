package win.ixuni.nimbus.driver.memory.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.exception.ObjectNotFoundException;
import win.ixuni.nimbus.core.model.StorageObject;
import win.ixuni.nimbus.core.operation.object.HeadObjectOperation;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext;
import win.ixuni.nimbus.driver.memory.handler.AbstractMemoryHandler;

/**
 * Memory HeadObject 处理器
 */
public class MemoryHeadObjectHandler extends AbstractMemoryHandler<HeadObjectOperation, StorageObject> {

    @Override
    protected Mono<StorageObject> doHandle(HeadObjectOperation operation, MemoryDriverContext context) {
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        return context.requireBucket(bucketName)
                .flatMap(bucket -> Mono.justOrEmpty(bucket.getObjects().get(key)))
                .map(object -> object.toStorageObject(bucketName))
                .switchIfEmpty(Mono.error(() -> new ObjectNotFoundException(bucketName, key)));
    }

    @Override
    public Class<HeadObjectOperation> getOperationType() {
        return HeadObjectOperation.class;
    }
}
