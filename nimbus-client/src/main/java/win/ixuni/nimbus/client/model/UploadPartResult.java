package win.ixuni.nimbus.client.model;

import lombok.Value;

@Value
public class UploadPartResult {

    /**
     * Quoted part ETag
     */
    String etag;
}
