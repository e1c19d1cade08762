package win.ixuni.nimbus.core.operation;

/**
 * Operation addressed to one object key inside a bucket
 *
 * @param <R> operation result type
 */
public interface ObjectOperation<R> extends BucketOperation<R> {

    String getKey();

    @Override
    default String getResource() {
        return "/" + getBucketName() + "/" + getKey();
    }
}
