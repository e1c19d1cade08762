package win.ixuni.nimbus.driver.memory.handler.object;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.exception.ObjectNotFoundException;
import win.ixuni.nimbus.core.model.StorageObjectData;
import win.ixuni.nimbus.core.operation.object.GetObjectOperation;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext;
import win.ixuni.nimbus.driver.memory.handler.AbstractMemoryHandler;

import java.nio.ByteBuffer;

/**
 * Memory GetObject 处理器
 */
public class MemoryGetObjectHandler extends AbstractMemoryHandler<GetObjectOperation, StorageObjectData> {

    @Override
    protected Mono<StorageObjectData> doHandle(GetObjectOperation operation, MemoryDriverContext context) {
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        return context.requireBucket(bucketName)
                .flatMap(bucket -> Mono.justOrEmpty(bucket.getObjects().get(key)))
                .switchIfEmpty(Mono.error(() -> new ObjectNotFoundException(bucketName, key)))
                .map(object -> StorageObjectData.builder()
                        .metadata(object.toStorageObject(bucketName))
                        // read-only view so consumers cannot alter the stored bytes
                        .content(Flux.defer(() -> Flux.just(ByteBuffer.wrap(object.getData()).asReadOnlyBuffer())))
                        .build());
    }

    @Override
    public Class<GetObjectOperation> getOperationType() {
        return GetObjectOperation.class;
    }
}
