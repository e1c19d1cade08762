package win.ixuni.nimbus.core.operation;

/**
 * Operation addressed to a single bucket
 *
 * @param <R> operation result type
 */
public interface BucketOperation<R> extends Operation<R> {

    String getBucketName();

    @Override
    default String getResource() {
        return "/" + getBucketName();
    }
}
