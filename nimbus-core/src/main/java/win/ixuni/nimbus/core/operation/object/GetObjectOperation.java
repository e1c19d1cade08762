package win.ixuni.nimbus.core.operation.object;

import lombok.Value;
import win.ixuni.nimbus.core.model.StorageObjectData;
import win.ixuni.nimbus.core.operation.ObjectOperation;

/**
 * 获取对象操作
 */
@Value
public class GetObjectOperation implements ObjectOperation<StorageObjectData> {

    String bucketName;

    String key;
}
