package win.ixuni.nimbus.core.operation.object;

import lombok.Value;
import win.ixuni.nimbus.core.operation.ObjectOperation;

/**
 * 删除对象操作
 * <p>
 * Succeeds for a key that does not exist.
 */
@Value
public class DeleteObjectOperation implements ObjectOperation<Void> {

    String bucketName;

    String key;
}
