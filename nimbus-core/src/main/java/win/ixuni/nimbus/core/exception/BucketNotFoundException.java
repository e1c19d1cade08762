package win.ixuni.nimbus.core.exception;

import lombok.Getter;

/**
 * NoSuchBucket (404)
 */
@Getter
public class BucketNotFoundException extends NimbusException {

    private final String bucketName;

    public BucketNotFoundException(String bucketName) {
        super("NoSuchBucket", "The specified bucket does not exist", 404, bucketResource(bucketName));
        this.bucketName = bucketName;
    }
}
