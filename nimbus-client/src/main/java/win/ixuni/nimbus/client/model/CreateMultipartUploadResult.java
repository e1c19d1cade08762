package win.ixuni.nimbus.client.model;

import lombok.Value;

@Value
public class CreateMultipartUploadResult {

    String bucket;

    String key;

    String uploadId;
}
