package win.ixuni.nimbus.core.operation.object;

import lombok.Builder;
import lombok.Value;
import reactor.core.publisher.Flux;
import win.ixuni.nimbus.core.model.StorageObject;
import win.ixuni.nimbus.core.operation.ObjectOperation;

import java.nio.ByteBuffer;
import java.util.Map;

/**
 * Put object operation
 */
@Value
@Builder
public class PutObjectOperation implements ObjectOperation<StorageObject> {

    /**
     * Bucket 名称
     */
    String bucketName;

    /**
     * 对象 Key
     */
    String key;

    /**
     * 对象内容流
     */
    Flux<ByteBuffer> content;

    String contentType;

    /**
     * User metadata (x-amz-meta-* without the prefix)
     */
    Map<String, String> metadata;

    /**
     * Base64 MD5 the client sent in Content-MD5; verified when present
     */
    String contentMd5;
}
