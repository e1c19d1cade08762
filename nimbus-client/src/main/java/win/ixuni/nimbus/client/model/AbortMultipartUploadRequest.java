package win.ixuni.nimbus.client.model;

import lombok.Value;

@Value
public class AbortMultipartUploadRequest {

    String bucket;

    String key;

    String uploadId;
}
