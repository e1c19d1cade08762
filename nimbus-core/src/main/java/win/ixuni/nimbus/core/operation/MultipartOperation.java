package win.ixuni.nimbus.core.operation;

/**
 * Operation on an in-progress multipart upload
 *
 * @param <R> operation result type
 */
public interface MultipartOperation<R> extends ObjectOperation<R> {

    String getUploadId();

    @Override
    default String getResource() {
        return "/" + getBucketName() + "/" + getKey() + "?uploadId=" + getUploadId();
    }
}
