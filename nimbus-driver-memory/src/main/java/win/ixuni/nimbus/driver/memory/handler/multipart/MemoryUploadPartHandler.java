package win.ixuni.nimbus.driver.memory.handler.multipart;

import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.exception.BadDigestException;
import win.ixuni.nimbus.core.exception.NoSuchUploadException;
import win.ixuni.nimbus.core.model.UploadPart;
import win.ixuni.nimbus.core.operation.multipart.UploadPartOperation;
import win.ixuni.nimbus.core.util.EtagUtils;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext.PartData;
import win.ixuni.nimbus.driver.memory.handler.AbstractMemoryHandler;

import java.util.HexFormat;

/**
 * Memory 上传分片处理器
 * <p>
 * Uploading the same part number again replaces the earlier part.
 */
public class MemoryUploadPartHandler extends AbstractMemoryHandler<UploadPartOperation, UploadPart> {

    static final int MAX_PART_NUMBER = 10000;

    @Override
    protected Mono<UploadPart> doHandle(UploadPartOperation operation, MemoryDriverContext context) {
        Integer partNumber = operation.getPartNumber();
        if (partNumber == null || partNumber < 1 || partNumber > MAX_PART_NUMBER) {
            return Mono.error(new IllegalArgumentException(
                    "Part number must be an integer between 1 and " + MAX_PART_NUMBER + ", got " + partNumber));
        }

        return context.requireBucket(operation.getBucketName())
                .then(context.requireUpload(operation.getUploadId()))
                .flatMap(state -> {
                    if (!state.getBucketName().equals(operation.getBucketName())
                            || !state.getKey().equals(operation.getKey())) {
                        return Mono.error(new NoSuchUploadException(operation.getUploadId()));
                    }
                    return readFully(operation.getContent()).flatMap(data -> {
                        byte[] digest = EtagUtils.md5(data);
                        if (!EtagUtils.matchesContentMd5(operation.getContentMd5(), digest)) {
                            return Mono.error(new BadDigestException(operation.getContentMd5()));
                        }
                        PartData part = PartData.builder()
                                .partNumber(partNumber)
                                .data(data)
                                .etag(HexFormat.of().formatHex(digest))
                                .lastModified(MemoryDriverContext.now())
                                .build();
                        state.getParts().put(partNumber, part);

                        return Mono.just(UploadPart.builder()
                                .partNumber(partNumber)
                                .etag(part.getEtag())
                                .size((long) data.length)
                                .lastModified(part.getLastModified())
                                .build());
                    });
                });
    }

    @Override
    public Class<UploadPartOperation> getOperationType() {
        return UploadPartOperation.class;
    }
}
