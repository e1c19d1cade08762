package win.ixuni.nimbus.client.model;

import lombok.Builder;
import lombok.Value;

/**
 * 上传分片请求
 */
@Value
@Builder
public class UploadPartRequest {

    String bucket;

    String key;

    String uploadId;

    int partNumber;

    /**
     * Sent as an empty payload when unset
     */
    byte[] body;

    Long contentLength;

    String contentMd5;

    public byte[] getBody() {
        return body != null ? body : new byte[0];
    }

    public long effectiveContentLength() {
        return contentLength != null ? contentLength : getBody().length;
    }
}
