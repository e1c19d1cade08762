package win.ixuni.nimbus.client.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * 上传对象请求
 */
@Value
@Builder
public class PutObjectRequest {

    String bucket;

    String key;

    /**
     * Sent as an empty payload when unset
     */
    byte[] body;

    /**
     * Defaults to the body length when unset
     */
    Long contentLength;

    /**
     * Base64 MD5 of the body, verified by the service
     */
    String contentMd5;

    String contentType;

    /**
     * User metadata, sent as {@code x-amz-meta-*} headers
     */
    @Singular("metadataEntry")
    Map<String, String> metadata;

    public byte[] getBody() {
        return body != null ? body : new byte[0];
    }

    public long effectiveContentLength() {
        return contentLength != null ? contentLength : getBody().length;
    }
}
