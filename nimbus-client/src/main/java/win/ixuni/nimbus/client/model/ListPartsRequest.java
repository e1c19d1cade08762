package win.ixuni.nimbus.client.model;

import lombok.Value;

@Value
public class ListPartsRequest {

    String bucket;

    String key;

    String uploadId;
}
