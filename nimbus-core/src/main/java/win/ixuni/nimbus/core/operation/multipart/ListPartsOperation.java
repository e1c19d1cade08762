package win.ixuni.nimbus.core.operation.multipart;

import lombok.Value;
import win.ixuni.nimbus.core.model.ListPartsResult;
import win.ixuni.nimbus.core.operation.MultipartOperation;

/**
 * List uploaded parts operation
 */
@Value
public class ListPartsOperation implements MultipartOperation<ListPartsResult> {

    String bucketName;

    String key;

    String uploadId;
}
