package win.ixuni.nimbus.client.model;

import lombok.Value;

@Value
public class DeleteBucketRequest {

    String bucket;
}
