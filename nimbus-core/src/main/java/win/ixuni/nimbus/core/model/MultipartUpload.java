package win.ixuni.nimbus.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * 分片上传会话
 * <p>
 * Returned by CreateMultipartUpload.
 */
@Value
@Builder
public class MultipartUpload {

    String uploadId;

    String bucketName;

    String key;

    Instant initiated;

    /**
     * Content type and user metadata the completed object will carry
     */
    String contentType;

    @Builder.Default
    Map<String, String> metadata = Map.of();
}
