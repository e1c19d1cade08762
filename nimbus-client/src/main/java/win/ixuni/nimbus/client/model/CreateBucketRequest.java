package win.ixuni.nimbus.client.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CreateBucketRequest {

    String bucket;

    /**
     * Optional canned ACL
     */
    BucketCannedAcl acl;
}
