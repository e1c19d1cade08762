package win.ixuni.nimbus.client.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ListObjectsRequest {

    String bucket;

    String prefix;

    String delimiter;

    /**
     * List keys after this one
     */
    String marker;

    /**
     * Server default (1000) when null
     */
    Integer maxKeys;
}
