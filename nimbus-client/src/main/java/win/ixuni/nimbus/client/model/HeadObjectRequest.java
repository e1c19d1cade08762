package win.ixuni.nimbus.client.model;

import lombok.Value;

@Value
public class HeadObjectRequest {

    String bucket;

    String key;
}
