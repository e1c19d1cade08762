package win.ixuni.nimbus.client.model;

import lombok.Value;

@Value
public class CompleteMultipartUploadResult {

    String location;

    String bucket;

    String key;

    /**
     * Quoted multipart ETag ({@code "<hex>-<parts>"})
     */
    String etag;
}
