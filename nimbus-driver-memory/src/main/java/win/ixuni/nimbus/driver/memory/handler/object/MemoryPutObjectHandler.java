package win.ixuni.nimbus.driver.memory.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.exception.BadDigestException;
import win.ixuni.nimbus.core.exception.BucketNotFoundException;
import win.ixuni.nimbus.core.model.StorageObject;
import win.ixuni.nimbus.core.operation.object.PutObjectOperation;
import win.ixuni.nimbus.core.util.EtagUtils;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext.ObjectData;
import win.ixuni.nimbus.driver.memory.handler.AbstractMemoryHandler;

import java.util.HexFormat;
import java.util.Map;

/**
 * Memory PutObject 处理器
 */
public class MemoryPutObjectHandler extends AbstractMemoryHandler<PutObjectOperation, StorageObject> {

    static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    @Override
    protected Mono<StorageObject> doHandle(PutObjectOperation operation, MemoryDriverContext context) {
        String bucketName = operation.getBucketName();

        return context.requireBucket(bucketName)
                .flatMap(bucket -> readFully(operation.getContent())
                        .flatMap(data -> {
                            byte[] digest = EtagUtils.md5(data);
                            if (!EtagUtils.matchesContentMd5(operation.getContentMd5(), digest)) {
                                return Mono.error(new BadDigestException(operation.getContentMd5()));
                            }

                            ObjectData object = ObjectData.builder()
                                    .key(operation.getKey())
                                    .data(data)
                                    .etag(HexFormat.of().formatHex(digest))
                                    .contentType(operation.getContentType() != null
                                            ? operation.getContentType() : DEFAULT_CONTENT_TYPE)
                                    .lastModified(MemoryDriverContext.now())
                                    .metadata(operation.getMetadata() != null
                                            ? Map.copyOf(operation.getMetadata()) : Map.of())
                                    .build();
                            if (!bucket.putObject(object)) {
                                return Mono.error(new BucketNotFoundException(bucketName));
                            }
                            return Mono.just(object.toStorageObject(bucketName));
                        }));
    }

    @Override
    public Class<PutObjectOperation> getOperationType() {
        return PutObjectOperation.class;
    }
}
