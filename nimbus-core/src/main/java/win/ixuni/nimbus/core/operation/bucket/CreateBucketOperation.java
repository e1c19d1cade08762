package win.ixuni.nimbus.core.operation.bucket;

import lombok.Value;
import win.ixuni.nimbus.core.model.StorageBucket;
import win.ixuni.nimbus.core.operation.BucketOperation;

/**
 * 创建 Bucket 操作
 */
@Value
public class CreateBucketOperation implements BucketOperation<StorageBucket> {

    /**
     * Bucket 名称
     */
    String bucketName;

    /**
     * Canned ACL from x-amz-acl, recorded but not enforced (may be null)
     */
    String cannedAcl;

    public CreateBucketOperation(String bucketName, String cannedAcl) {
        this.bucketName = bucketName;
        this.cannedAcl = cannedAcl;
    }

    public CreateBucketOperation(String bucketName) {
        this(bucketName, null);
    }
}
