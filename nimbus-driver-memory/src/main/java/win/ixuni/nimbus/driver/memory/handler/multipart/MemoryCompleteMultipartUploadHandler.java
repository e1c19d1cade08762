package win.ixuni.nimbus.driver.memory.handler.multipart;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.exception.BucketNotFoundException;
import win.ixuni.nimbus.core.exception.EntityTooSmallException;
import win.ixuni.nimbus.core.exception.InvalidPartException;
import win.ixuni.nimbus.core.exception.InvalidPartOrderException;
import win.ixuni.nimbus.core.exception.NoSuchUploadException;
import win.ixuni.nimbus.core.model.CompletedPart;
import win.ixuni.nimbus.core.model.StorageObject;
import win.ixuni.nimbus.core.operation.multipart.CompleteMultipartUploadOperation;
import win.ixuni.nimbus.core.util.EtagUtils;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext.BucketInfo;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext.MultipartState;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext.ObjectData;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext.PartData;
import win.ixuni.nimbus.driver.memory.handler.AbstractMemoryHandler;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Memory 完成分片上传处理器
 * <p>
 * The listed parts must be ascending, must exist with matching ETags, and all but the last must
 * reach the driver's minimum part size. The object is the concatenation of the listed parts only.
 */
@Slf4j
public class MemoryCompleteMultipartUploadHandler
        extends AbstractMemoryHandler<CompleteMultipartUploadOperation, StorageObject> {

    @Override
    protected Mono<StorageObject> doHandle(CompleteMultipartUploadOperation operation, MemoryDriverContext context) {
        String bucketName = operation.getBucketName();
        String uploadId = operation.getUploadId();

        return context.requireBucket(bucketName)
                .zipWith(context.requireUpload(uploadId))
                .flatMap(tuple -> {
                    BucketInfo bucket = tuple.getT1();
                    MultipartState state = tuple.getT2();
                    if (!state.getBucketName().equals(bucketName) || !state.getKey().equals(operation.getKey())) {
                        return Mono.error(new NoSuchUploadException(uploadId));
                    }
                    return Mono.fromCallable(() -> assemble(operation, state, context.getMinPartSize()))
                            .flatMap(object -> {
                                if (!bucket.putObject(object)) {
                                    return Mono.error(new BucketNotFoundException(bucketName));
                                }
                                context.getMultipartUploads().remove(uploadId);
                                log.debug("Completed multipart upload {} into {}/{} ({} bytes)",
                                        uploadId, bucketName, object.getKey(), object.getData().length);
                                return Mono.just(object.toStorageObject(bucketName));
                            });
                });
    }

    private ObjectData assemble(CompleteMultipartUploadOperation operation, MultipartState state, long minPartSize) {
        List<CompletedPart> requested = operation.getParts();
        if (requested == null || requested.isEmpty()) {
            throw new InvalidPartOrderException(state.getUploadId());
        }

        List<PartData> parts = new ArrayList<>(requested.size());
        int previous = 0;
        for (CompletedPart completed : requested) {
            int partNumber = completed.getPartNumber() != null ? completed.getPartNumber() : 0;
            if (partNumber <= previous) {
                throw new InvalidPartOrderException(state.getUploadId());
            }
            previous = partNumber;

            PartData part = state.getParts().get(partNumber);
            if (part == null || !completed.matches(part.getEtag())) {
                throw new InvalidPartException(state.getUploadId(), partNumber);
            }
            parts.add(part);
        }

        for (int i = 0; i < parts.size() - 1; i++) {
            PartData part = parts.get(i);
            if (part.getData().length < minPartSize) {
                throw new EntityTooSmallException(part.getPartNumber(), part.getData().length, minPartSize);
            }
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        List<String> etags = new ArrayList<>(parts.size());
        for (PartData part : parts) {
            out.write(part.getData(), 0, part.getData().length);
            etags.add(part.getEtag());
        }

        return ObjectData.builder()
                .key(state.getKey())
                .data(out.toByteArray())
                .etag(EtagUtils.multipartEtag(etags))
                .contentType(state.getContentType() != null ? state.getContentType() : "application/octet-stream")
                .lastModified(MemoryDriverContext.now())
                .metadata(state.getMetadata())
                .build();
    }

    @Override
    public Class<CompleteMultipartUploadOperation> getOperationType() {
        return CompleteMultipartUploadOperation.class;
    }
}
