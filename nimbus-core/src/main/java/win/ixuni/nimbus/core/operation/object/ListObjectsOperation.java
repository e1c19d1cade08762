package win.ixuni.nimbus.core.operation.object;

import lombok.Value;
import win.ixuni.nimbus.core.model.ListBucketResult;
import win.ixuni.nimbus.core.model.ListObjectsRequest;
import win.ixuni.nimbus.core.operation.BucketOperation;

/**
 * 列出对象操作 (ListObjects v1)
 */
@Value
public class ListObjectsOperation implements BucketOperation<ListBucketResult> {

    /**
     * 请求参数
     */
    ListObjectsRequest request;

    @Override
    public String getBucketName() {
        return request.getBucketName();
    }
}
