package win.ixuni.nimbus.core.operation.bucket;

import lombok.Value;
import win.ixuni.nimbus.core.operation.BucketOperation;

/**
 * HeadBucket: completes with {@code false} instead of failing for an unknown bucket
 */
@Value
public class BucketExistsOperation implements BucketOperation<Boolean> {

    String bucketName;
}
