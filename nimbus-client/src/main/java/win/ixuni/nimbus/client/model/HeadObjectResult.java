package win.ixuni.nimbus.client.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class HeadObjectResult {

    String etag;

    long contentLength;

    String contentType;

    Instant lastModified;

    Map<String, String> metadata;
}
