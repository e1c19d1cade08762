package win.ixuni.nimbus.core.exception;

/**
 * Thrown when a bucket name breaks the S3 naming rules.
 */
public class InvalidBucketNameException extends NimbusException {

    public InvalidBucketNameException(String bucketName, String reason) {
        super("InvalidBucketName", "The specified bucket is not valid: " + reason, 400, bucketResource(bucketName));
    }
}
