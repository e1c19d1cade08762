package win.ixuni.nimbus.client.model;

import lombok.Builder;
import lombok.Value;

import java.io.OutputStream;
import java.util.function.Supplier;

@Value
@Builder
public class GetObjectRequest {

    String bucket;

    String key;

    /**
     * When set, the body is written into the supplied stream instead of being buffered.
     * The stream is closed once the download completes.
     */
    Supplier<OutputStream> responseStreamFactory;
}
