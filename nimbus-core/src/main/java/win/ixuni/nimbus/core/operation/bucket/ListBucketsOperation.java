package win.ixuni.nimbus.core.operation.bucket;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import win.ixuni.nimbus.core.model.StorageBucket;
import win.ixuni.nimbus.core.operation.Operation;

import java.util.List;

/**
 * 列出所有 Bucket
 */
@ToString
@EqualsAndHashCode
public class ListBucketsOperation implements Operation<List<StorageBucket>> {
}
