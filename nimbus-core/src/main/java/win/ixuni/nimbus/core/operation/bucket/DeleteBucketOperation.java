package win.ixuni.nimbus.core.operation.bucket;

import lombok.Value;
import win.ixuni.nimbus.core.operation.BucketOperation;

/**
 * 删除 Bucket 操作
 * <p>
 * Rejected with BucketNotEmpty while the bucket holds objects.
 */
@Value
public class DeleteBucketOperation implements BucketOperation<Void> {

    String bucketName;
}
