package win.ixuni.nimbus.core.operation.multipart;

import lombok.Builder;
import lombok.Value;
import reactor.core.publisher.Flux;
import win.ixuni.nimbus.core.model.UploadPart;
import win.ixuni.nimbus.core.operation.MultipartOperation;

import java.nio.ByteBuffer;

/**
 * 上传分片操作
 */
@Value
@Builder
public class UploadPartOperation implements MultipartOperation<UploadPart> {

    /**
     * Bucket 名称
     */
    String bucketName;

    /**
     * 对象 Key
     */
    String key;

    /**
     * 上传 ID
     */
    String uploadId;

    /**
     * 分片编号 (1-10000)
     */
    Integer partNumber;

    /**
     * 分片内容
     */
    Flux<ByteBuffer> content;

    /**
     * Base64 Content-MD5, may be null
     */
    String contentMd5;
}
