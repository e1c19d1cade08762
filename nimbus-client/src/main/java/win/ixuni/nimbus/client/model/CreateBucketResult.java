package win.ixuni.nimbus.client.model;

import lombok.Value;

@Value
public class CreateBucketResult {

    /**
     * Location header of the new bucket
     */
    String location;
}
