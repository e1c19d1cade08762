package win.ixuni.nimbus.core.operation.object;

import lombok.Value;
import win.ixuni.nimbus.core.model.StorageObject;
import win.ixuni.nimbus.core.operation.ObjectOperation;

/**
 * 获取对象元数据
 */
@Value
public class HeadObjectOperation implements ObjectOperation<StorageObject> {

    String bucketName;

    String key;
}
