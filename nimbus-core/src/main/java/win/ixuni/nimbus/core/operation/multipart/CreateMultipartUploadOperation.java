package win.ixuni.nimbus.core.operation.multipart;

import lombok.Value;
import win.ixuni.nimbus.core.model.MultipartUpload;
import win.ixuni.nimbus.core.operation.ObjectOperation;

import java.util.Map;

/**
 * 初始化分片上传操作
 */
@Value
public class CreateMultipartUploadOperation implements ObjectOperation<MultipartUpload> {

    String bucketName;

    String key;

    String contentType;

    /**
     * User metadata applied to the completed object
     */
    Map<String, String> metadata;
}
