package win.ixuni.nimbus.driver.memory.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.model.ListBucketResult;
import win.ixuni.nimbus.core.model.ListObjectsRequest;
import win.ixuni.nimbus.core.model.StorageObject;
import win.ixuni.nimbus.core.operation.object.ListObjectsOperation;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext.ObjectData;
import win.ixuni.nimbus.driver.memory.handler.AbstractMemoryHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;

/**
 * Memory ListObjects 处理器 (V1)
 * <p>
 * Keys and common prefixes share the max-keys budget, in key order. When the page is cut short,
 * NextMarker is the last key or common prefix returned.
 */
public class MemoryListObjectsHandler extends AbstractMemoryHandler<ListObjectsOperation, ListBucketResult> {

    @Override
    protected Mono<ListBucketResult> doHandle(ListObjectsOperation operation, MemoryDriverContext context) {
        ListObjectsRequest request = operation.getRequest();
        String bucketName = request.getBucketName();

        return context.requireBucket(bucketName)
                .map(bucket -> list(bucketName, bucket.getObjects(), request));
    }

    private ListBucketResult list(String bucketName, NavigableMap<String, ObjectData> objects,
                                  ListObjectsRequest request) {
        String prefix = request.effectivePrefix();
        String delimiter = request.effectiveDelimiter();
        String marker = request.effectiveMarker();
        int maxKeys = request.effectiveMaxKeys();

        NavigableMap<String, ObjectData> candidates = marker.isEmpty() ? objects : objects.tailMap(marker, false);

        List<StorageObject> contents = new ArrayList<>();
        List<ListBucketResult.CommonPrefix> commonPrefixes = new ArrayList<>();
        String lastEmitted = null;
        boolean truncated = false;

        for (Map.Entry<String, ObjectData> entry : candidates.entrySet()) {
            String key = entry.getKey();
            if (!key.startsWith(prefix)) {
                if (key.compareTo(prefix) > 0) {
                    break;
                }
                continue;
            }

            String rolledUp = null;
            if (delimiter != null) {
                int index = key.indexOf(delimiter, prefix.length());
                if (index >= 0) {
                    rolledUp = key.substring(0, index + delimiter.length());
                }
            }
            if (rolledUp != null && rolledUp.equals(lastEmitted)) {
                continue;
            }

            if (contents.size() + commonPrefixes.size() >= maxKeys) {
                truncated = true;
                break;
            }

            if (rolledUp != null) {
                commonPrefixes.add(ListBucketResult.CommonPrefix.builder().prefix(rolledUp).build());
                lastEmitted = rolledUp;
            } else {
                contents.add(entry.getValue().toStorageObject(bucketName));
                lastEmitted = key;
            }
        }

        return ListBucketResult.builder()
                .bucketName(bucketName)
                .prefix(prefix)
                .marker(marker)
                .maxKeys(maxKeys)
                .delimiter(delimiter)
                .isTruncated(truncated)
                .nextMarker(truncated && delimiter != null ? lastEmitted : null)
                .contents(contents)
                .commonPrefixes(commonPrefixes)
                .build();
    }

    @Override
    public Class<ListObjectsOperation> getOperationType() {
        return ListObjectsOperation.class;
    }
}
