package win.ixuni.nimbus.core.operation.multipart;

import lombok.Value;
import win.ixuni.nimbus.core.model.CompletedPart;
import win.ixuni.nimbus.core.model.StorageObject;
import win.ixuni.nimbus.core.operation.MultipartOperation;

import java.util.List;

/**
 * 完成分片上传操作
 */
@Value
public class CompleteMultipartUploadOperation implements MultipartOperation<StorageObject> {

    String bucketName;

    String key;

    String uploadId;

    /**
     * Parts in the order the client listed them
     */
    List<CompletedPart> parts;
}
