package win.ixuni.nimbus.driver.memory.handler.multipart;

import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.model.MultipartUpload;
import win.ixuni.nimbus.core.operation.multipart.CreateMultipartUploadOperation;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext.MultipartState;
import win.ixuni.nimbus.driver.memory.handler.AbstractMemoryHandler;

import java.util.Map;
import java.util.UUID;

/**
 * Memory 初始化分片上传处理器
 */
public class MemoryCreateMultipartUploadHandler
        extends AbstractMemoryHandler<CreateMultipartUploadOperation, MultipartUpload> {

    @Override
    protected Mono<MultipartUpload> doHandle(CreateMultipartUploadOperation operation, MemoryDriverContext context) {
        return context.requireBucket(operation.getBucketName())
                .map(bucket -> {
                    MultipartState state = MultipartState.builder()
                            .uploadId(UUID.randomUUID().toString().replace("-", ""))
                            .bucketName(operation.getBucketName())
                            .key(operation.getKey())
                            .contentType(operation.getContentType())
                            .metadata(operation.getMetadata() != null ? Map.copyOf(operation.getMetadata()) : Map.of())
                            .initiated(MemoryDriverContext.now())
                            .build();
                    context.getMultipartUploads().put(state.getUploadId(), state);

                    return MultipartUpload.builder()
                            .uploadId(state.getUploadId())
                            .bucketName(state.getBucketName())
                            .key(state.getKey())
                            .initiated(state.getInitiated())
                            .contentType(state.getContentType())
                            .metadata(state.getMetadata())
                            .build();
                });
    }

    @Override
    public Class<CreateMultipartUploadOperation> getOperationType() {
        return CreateMultipartUploadOperation.class;
    }
}
