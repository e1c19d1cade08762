package win.ixuni.nimbus.core.exception;

/**
 * BucketAlreadyExists (409), only raised when the driver runs with strict bucket creation.
 */
public class BucketAlreadyExistsException extends NimbusException {

    public BucketAlreadyExistsException(String bucketName) {
        super("BucketAlreadyExists", "The requested bucket name is not available. "
                + "Please select a different name and try again.", 409, bucketResource(bucketName));
    }
}
