package win.ixuni.nimbus.driver.memory.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.model.StorageBucket;
import win.ixuni.nimbus.core.operation.bucket.ListBucketsOperation;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext;
import win.ixuni.nimbus.driver.memory.handler.AbstractMemoryHandler;

import java.util.Comparator;
import java.util.List;

/**
 * Memory 列出 Bucket 处理器，按名称排序
 */
public class MemoryListBucketsHandler extends AbstractMemoryHandler<ListBucketsOperation, List<StorageBucket>> {

    @Override
    protected Mono<List<StorageBucket>> doHandle(ListBucketsOperation operation, MemoryDriverContext context) {
        List<StorageBucket> buckets = context.getBuckets().values().stream()
                .map(bucket -> StorageBucket.builder()
                        .name(bucket.getName())
                        .creationDate(bucket.getCreationDate())
                        .cannedAcl(bucket.getCannedAcl())
                        .driverName(context.getDriverName())
                        .build())
                .sorted(Comparator.comparing(StorageBucket::getName))
                .toList();
        return Mono.just(buckets);
    }

    @Override
    public Class<ListBucketsOperation> getOperationType() {
        return ListBucketsOperation.class;
    }
}
