package win.ixuni.nimbus.driver.memory.handler.multipart;

import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.exception.NoSuchUploadException;
import win.ixuni.nimbus.core.model.ListPartsResult;
import win.ixuni.nimbus.core.model.UploadPart;
import win.ixuni.nimbus.core.operation.multipart.ListPartsOperation;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext;
import win.ixuni.nimbus.driver.memory.handler.AbstractMemoryHandler;

import java.util.List;

/**
 * Memory 列出分片处理器
 */
public class MemoryListPartsHandler extends AbstractMemoryHandler<ListPartsOperation, ListPartsResult> {

    private static final int MAX_PARTS = 1000;

    @Override
    protected Mono<ListPartsResult> doHandle(ListPartsOperation operation, MemoryDriverContext context) {
        return context.requireBucket(operation.getBucketName())
                .then(context.requireUpload(operation.getUploadId()))
                .flatMap(state -> {
                    if (!state.getBucketName().equals(operation.getBucketName())) {
                        return Mono.error(new NoSuchUploadException(operation.getUploadId()));
                    }
                    List<UploadPart> parts = state.getParts().values().stream()
                            .map(part -> UploadPart.builder()
                                    .partNumber(part.getPartNumber())
                                    .etag(part.getEtag())
                                    .size((long) part.getData().length)
                                    .lastModified(part.getLastModified())
                                    .build())
                            .toList();

                    return Mono.just(ListPartsResult.builder()
                            .bucketName(state.getBucketName())
                            .key(state.getKey())
                            .uploadId(state.getUploadId())
                            .partNumberMarker(0)
                            .nextPartNumberMarker(parts.isEmpty() ? 0 : parts.get(parts.size() - 1).getPartNumber())
                            .maxParts(MAX_PARTS)
                            .isTruncated(false)
                            .parts(parts)
                            .build());
                });
    }

    @Override
    public Class<ListPartsOperation> getOperationType() {
        return ListPartsOperation.class;
    }
}
