package win.ixuni.nimbus.client.model;

import lombok.Value;

@Value
public class PutObjectResult {

    /**
     * Quoted ETag as returned by the service
     */
    String etag;
}
