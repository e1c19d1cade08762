package win.ixuni.nimbus.client.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CompleteMultipartUploadRequest {

    String bucket;

    String key;

    String uploadId;

    CompletedMultipartUpload multipartUpload;
}
