package win.ixuni.nimbus.client.model;

import lombok.Value;

import java.util.List;

@Value
public class ListBucketsResult {

    List<Bucket> buckets;

    public boolean contains(String bucketName) {
        return buckets.stream().anyMatch(bucket -> bucket.getName().equals(bucketName));
    }
}
