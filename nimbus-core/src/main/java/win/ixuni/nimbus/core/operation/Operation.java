package win.ixuni.nimbus.core.operation;

/**
 * Storage operation
 * <p>
 * Every storage call (CreateBucket, PutObject, ...) is a command object implementing this
 * interface. Operations scoped to a bucket, an object or a multipart upload implement
 * {@link BucketOperation}, {@link ObjectOperation} or {@link MultipartOperation}.
 *
 * @param <R> operation result type
 */
public interface Operation<R> {

    /**
     * @return name such as "CreateBucket" or "PutObject"
     */
    default String getOperationName() {
        String className = getClass().getSimpleName();
        return className.endsWith("Operation")
                ? className.substring(0, className.length() - "Operation".length())
                : className;
    }

    /**
     * S3 resource the operation addresses, for logs
     */
    default String getResource() {
        return "/";
    }
}
