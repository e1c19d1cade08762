package win.ixuni.nimbus.driver.memory.handler.multipart;

import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.exception.NoSuchUploadException;
import win.ixuni.nimbus.core.operation.multipart.AbortMultipartUploadOperation;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext;
import win.ixuni.nimbus.driver.memory.handler.AbstractMemoryHandler;

/**
 * Memory 中止分片上传处理器
 */
public class MemoryAbortMultipartUploadHandler extends AbstractMemoryHandler<AbortMultipartUploadOperation, Void> {

    @Override
    protected Mono<Void> doHandle(AbortMultipartUploadOperation operation, MemoryDriverContext context) {
        String uploadId = operation.getUploadId();
        return context.requireBucket(operation.getBucketName())
                .then(context.requireUpload(uploadId))
                .flatMap(state -> {
                    if (!state.getBucketName().equals(operation.getBucketName())
                            || !context.getMultipartUploads().remove(uploadId, state)) {
                        return Mono.error(new NoSuchUploadException(uploadId));
                    }
                    return Mono.<Void>empty();
                });
    }

    @Override
    public Class<AbortMultipartUploadOperation> getOperationType() {
        return AbortMultipartUploadOperation.class;
    }
}
