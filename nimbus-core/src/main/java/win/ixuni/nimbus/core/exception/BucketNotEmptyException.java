package win.ixuni.nimbus.core.exception;

/**
 * BucketNotEmpty (409), raised by DeleteBucket while objects remain.
 */
public class BucketNotEmptyException extends NimbusException {

    public BucketNotEmptyException(String bucketName, int objectCount) {
        super("BucketNotEmpty", "The bucket you tried to delete is not empty (" + objectCount + " objects)",
                409, bucketResource(bucketName));
    }
}
