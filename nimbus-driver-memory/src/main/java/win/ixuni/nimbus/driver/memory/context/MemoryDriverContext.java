package win.ixuni.nimbus.driver.memory.context;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.config.DriverConfig;
import win.ixuni.nimbus.core.exception.BucketNotFoundException;
import win.ixuni.nimbus.core.exception.NoSuchUploadException;
import win.ixuni.nimbus.core.model.StorageObject;
import win.ixuni.nimbus.core.operation.DriverContext;
import win.ixuni.nimbus.core.operation.OperationHandlerRegistry;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Memory 驱动上下文
 * <p>
 * Shared in-memory data structures for all memory handlers.
 */
@Getter
@Builder
public class MemoryDriverContext implements DriverContext {

    public static final String MIN_PART_SIZE_PROPERTY = "min-part-size";
    public static final String STRICT_CREATE_PROPERTY = "strict-create";
    public static final long DEFAULT_MIN_PART_SIZE = 5L * 1024 * 1024;

    private final DriverConfig config;

    /**
     * Bucket 存储：bucketName -> BucketInfo
     */
    @Builder.Default
    private final Map<String, BucketInfo> buckets = new ConcurrentHashMap<>();

    /**
     * 分片上传状态：uploadId -> MultipartState
     */
    @Builder.Default
    private final Map<String, MultipartState> multipartUploads = new ConcurrentHashMap<>();

    /**
     * Minimum size of every part except the last
     */
    @Builder.Default
    private final long minPartSize = DEFAULT_MIN_PART_SIZE;

    private final boolean strictCreate;

    @Setter
    private OperationHandlerRegistry handlerRegistry;

    @Override
    public DriverConfig getConfig() {
        return config;
    }

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public String getDriverType() {
        return "memory";
    }

    /**
     * Look up a bucket or fail with NoSuchBucket
     */
    public Mono<BucketInfo> requireBucket(String bucketName) {
        BucketInfo bucket = bucketName == null ? null : buckets.get(bucketName);
        return bucket != null ? Mono.just(bucket) : Mono.error(new BucketNotFoundException(bucketName));
    }

    /**
     * Look up an upload or fail with NoSuchUpload
     */
    public Mono<MultipartState> requireUpload(String uploadId) {
        MultipartState state = uploadId == null ? null : multipartUploads.get(uploadId);
        return state != null ? Mono.just(state) : Mono.error(new NoSuchUploadException(uploadId));
    }

    /**
     * Millisecond precision, matching the HTTP date headers and list documents
     */
    public static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    @Getter
    @Builder
    public static class BucketInfo {
        private final String name;
        private final Instant creationDate;
        private final String cannedAcl;

        /**
         * Objects sorted by key
         */
        @Builder.Default
        private final NavigableMap<String, ObjectData> objects = new ConcurrentSkipListMap<>();

        /**
         * Set once, under the bucket's lock, when DeleteBucket detaches it
         */
        @Getter(AccessLevel.NONE)
        private boolean removed;

        /**
         * Store an object unless the bucket has been deleted meanwhile
         *
         * @return false when the bucket is gone and nothing was stored
         */
        public synchronized boolean putObject(ObjectData object) {
            if (removed) {
                return false;
            }
            objects.put(object.getKey(), object);
            return true;
        }

        /**
         * Mark the bucket removed if it holds no objects; no write lands after a successful call
         */
        public synchronized boolean markRemovedIfEmpty() {
            if (!objects.isEmpty()) {
                return false;
            }
            removed = true;
            return true;
        }
    }

    @Getter
    @Builder
    public static class ObjectData {
        private final String key;
        private final byte[] data;
        /**
         * Bare hex ETag
         */
        private final String etag;
        private final String contentType;
        private final Instant lastModified;
        private final Map<String, String> metadata;

        public StorageObject toStorageObject(String bucketName) {
            return StorageObject.builder()
                    .bucketName(bucketName)
                    .key(key)
                    .size((long) data.length)
                    .etag(etag)
                    .lastModified(lastModified)
                    .contentType(contentType)
                    .userMetadata(metadata)
                    .build();
        }
    }

    @Getter
    @Builder
    public static class MultipartState {
        private final String uploadId;
        private final String bucketName;
        private final String key;
        private final String contentType;
        private final Map<String, String> metadata;
        private final Instant initiated;
        @Builder.Default
        private final NavigableMap<Integer, PartData> parts = new ConcurrentSkipListMap<>();
    }

    @Getter
    @Builder
    public static class PartData {
        private final int partNumber;
        private final byte[] data;
        private final String etag;
        private final Instant lastModified;
    }
}
