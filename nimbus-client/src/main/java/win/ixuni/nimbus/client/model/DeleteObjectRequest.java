package win.ixuni.nimbus.client.model;

import lombok.Value;

@Value
public class DeleteObjectRequest {

    String bucket;

    String key;
}
