package win.ixuni.nimbus.client.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class CreateMultipartUploadRequest {

    String bucket;

    String key;

    String contentType;

    @Singular("metadataEntry")
    Map<String, String> metadata;
}
