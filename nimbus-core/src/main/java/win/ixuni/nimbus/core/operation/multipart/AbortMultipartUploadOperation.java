package win.ixuni.nimbus.core.operation.multipart;

import lombok.Value;
import win.ixuni.nimbus.core.operation.MultipartOperation;

/**
 * 中止分片上传操作
 * <p>
 * Uploaded parts are discarded; later calls with the same upload id fail with NoSuchUpload.
 */
@Value
public class AbortMultipartUploadOperation implements MultipartOperation<Void> {

    String bucketName;

    String key;

    String uploadId;
}
