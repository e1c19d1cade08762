package win.ixuni.nimbus.driver.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import win.ixuni.nimbus.core.config.DriverConfig;
import win.ixuni.nimbus.core.exception.BadDigestException;
import win.ixuni.nimbus.core.exception.BucketAlreadyExistsException;
import win.ixuni.nimbus.core.exception.BucketNotEmptyException;
import win.ixuni.nimbus.core.exception.BucketNotFoundException;
import win.ixuni.nimbus.core.exception.EntityTooSmallException;
import win.ixuni.nimbus.core.exception.InvalidBucketNameException;
import win.ixuni.nimbus.core.exception.InvalidPartException;
import win.ixuni.nimbus.core.exception.InvalidPartOrderException;
import win.ixuni.nimbus.core.exception.NoSuchUploadException;
import win.ixuni.nimbus.core.exception.ObjectNotFoundException;
import win.ixuni.nimbus.core.model.CompletedPart;
import win.ixuni.nimbus.core.model.ListBucketResult;
import win.ixuni.nimbus.core.model.ListObjectsRequest;
import win.ixuni.nimbus.core.model.StorageBucket;
import win.ixuni.nimbus.core.model.StorageObject;
import win.ixuni.nimbus.core.model.UploadPart;
import win.ixuni.nimbus.core.operation.bucket.BucketExistsOperation;
import win.ixuni.nimbus.core.operation.bucket.CreateBucketOperation;
import win.ixuni.nimbus.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.nimbus.core.operation.bucket.ListBucketsOperation;
import win.ixuni.nimbus.core.operation.multipart.AbortMultipartUploadOperation;
import win.ixuni.nimbus.core.operation.multipart.CompleteMultipartUploadOperation;
import win.ixuni.nimbus.core.operation.multipart.CreateMultipartUploadOperation;
import win.ixuni.nimbus.core.operation.multipart.ListPartsOperation;
import win.ixuni.nimbus.core.operation.multipart.UploadPartOperation;
import win.ixuni.nimbus.core.operation.object.DeleteObjectOperation;
import win.ixuni.nimbus.core.operation.object.GetObjectOperation;
import win.ixuni.nimbus.core.operation.object.HeadObjectOperation;
import win.ixuni.nimbus.core.operation.object.ListObjectsOperation;
import win.ixuni.nimbus.core.operation.object.PutObjectOperation;
import win.ixuni.nimbus.core.util.EtagUtils;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MemoryStorageDriverTest {

    private static final String BUCKET = "memory-test-bucket";

    private MemoryStorageDriver driver;

    @BeforeEach
    void setUp() {
        driver = newDriver(Map.of(MemoryDriverContext.MIN_PART_SIZE_PROPERTY, 4));
        driver.execute(new CreateBucketOperation(BUCKET, "private")).block();
    }

    private static MemoryStorageDriver newDriver(Map<String, Object> properties) {
        DriverConfig config = new DriverConfig();
        config.setName("memory-test");
        config.setType(MemoryDriverFactory.DRIVER_TYPE);
        config.getProperties().putAll(properties);
        return (MemoryStorageDriver) new MemoryDriverFactory().createDriver(config);
    }

    private StorageObject put(String key, String content) {
        return driver.execute(PutObjectOperation.builder()
                .bucketName(BUCKET)
                .key(key)
                .content(body(content))
                .contentType("text/plain")
                .build()).block();
    }

    private static Flux<ByteBuffer> body(String content) {
        return Flux.just(ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8)));
    }

    private static String read(Flux<ByteBuffer> content) {
        return content.map(buffer -> {
                    byte[] bytes = new byte[buffer.remaining()];
                    buffer.get(bytes);
                    return new String(bytes, StandardCharsets.UTF_8);
                })
                .reduce("", String::concat)
                .block();
    }

    @Nested
    @DisplayName("Bucket 操作")
    class Buckets {

        @Test
        void createIsIdempotentAndRecordsAcl() {
            StepVerifier.create(driver.execute(new CreateBucketOperation(BUCKET, "public-read-write")))
                    .assertNext(bucket -> {
                        assertEquals(BUCKET, bucket.getName());
                        assertEquals("private", bucket.getCannedAcl());
                    })
                    .verifyComplete();
        }

        @Test
        void strictCreateRejectsExistingBucket() {
            MemoryStorageDriver strict = newDriver(Map.of("strict-create", true));
            strict.execute(new CreateBucketOperation("strict-bucket")).block();

            StepVerifier.create(strict.execute(new CreateBucketOperation("strict-bucket")))
                    .expectError(BucketAlreadyExistsException.class)
                    .verify();
        }

        @Test
        @DisplayName("负数 min-part-size 在创建驱动时被拒绝")
        void factoryRejectsNegativeMinPartSize() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> newDriver(Map.of(MemoryDriverContext.MIN_PART_SIZE_PROPERTY, -1)));
            assertTrue(e.getMessage().contains("min-part-size"));
        }

        @Test
        void rejectsInvalidName() {
            StepVerifier.create(driver.execute(new CreateBucketOperation("Non-Existent")))
                    .expectError(InvalidBucketNameException.class)
                    .verify();
        }

        @Test
        void listExistsAndDelete() {
            driver.execute(new CreateBucketOperation("another-bucket")).block();

            List<StorageBucket> buckets = driver.execute(new ListBucketsOperation()).block();
            assertNotNull(buckets);
            assertEquals(List.of("another-bucket", BUCKET), buckets.stream().map(StorageBucket::getName).toList());

            StepVerifier.create(driver.execute(new DeleteBucketOperation("another-bucket"))).verifyComplete();
            StepVerifier.create(driver.execute(new BucketExistsOperation("another-bucket")))
                    .expectNext(false)
                    .verifyComplete();
        }

        @Test
        @DisplayName("非空 Bucket 不能删除")
        void deleteNonEmptyFails() {
            put("a.txt", "a");

            StepVerifier.create(driver.execute(new DeleteBucketOperation(BUCKET)))
                    .expectError(BucketNotEmptyException.class)
                    .verify();
        }

        @Test
        void deleteMissingFails() {
            StepVerifier.create(driver.execute(new DeleteBucketOperation("missing-bucket")))
                    .expectError(BucketNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("上传过程中 Bucket 被删除，写入失败而不是静默丢失")
        void putIntoBucketDeletedMidUploadFails() {
            Flux<ByteBuffer> content = Mono.defer(() -> driver.execute(new DeleteBucketOperation(BUCKET)))
                    .thenMany(body("late"));

            StepVerifier.create(driver.execute(PutObjectOperation.builder()
                            .bucketName(BUCKET)
                            .key("late.txt")
                            .content(content)
                            .build()))
                    .expectError(BucketNotFoundException.class)
                    .verify();
            StepVerifier.create(driver.execute(new BucketExistsOperation(BUCKET)))
                    .expectNext(false)
                    .verifyComplete();
        }

        @Test
        void removedBucketRefusesWrites() {
            MemoryDriverContext.BucketInfo bucket = MemoryDriverContext.BucketInfo.builder().name("detached").build();
            MemoryDriverContext.ObjectData object = MemoryDriverContext.ObjectData.builder()
                    .key("k")
                    .data(new byte[0])
                    .build();

            assertTrue(bucket.markRemovedIfEmpty());
            assertFalse(bucket.putObject(object));
            assertTrue(bucket.getObjects().isEmpty());
        }

        @Test
        void nonEmptyBucketIsNotMarkedRemoved() {
            MemoryDriverContext.BucketInfo bucket = MemoryDriverContext.BucketInfo.builder().name("busy").build();
            assertTrue(bucket.putObject(MemoryDriverContext.ObjectData.builder().key("k").data(new byte[0]).build()));

            assertFalse(bucket.markRemovedIfEmpty());
            assertTrue(bucket.putObject(MemoryDriverContext.ObjectData.builder().key("k2").data(new byte[0]).build()));
        }

        @Test
        void deleteDiscardsPendingUploads() {
            String uploadId = driver.execute(new CreateMultipartUploadOperation(BUCKET, "big", null, null))
                    .block().getUploadId();

            driver.execute(new DeleteBucketOperation(BUCKET)).block();

            StepVerifier.create(driver.execute(new AbortMultipartUploadOperation(BUCKET, "big", uploadId)))
                    .expectError(BucketNotFoundException.class)
                    .verify();
            assertTrue(((MemoryDriverContext) driver.getDriverContext()).getMultipartUploads().isEmpty());
        }
    }

    @Nested
    @DisplayName("对象操作")
    class ObjectOperations {

        @Test
        void putGetHeadDelete() {
            StorageObject stored = put("dir/Test Object.txt", "Test Object");
            assertEquals(EtagUtils.md5Hex("Test Object".getBytes(StandardCharsets.UTF_8)), stored.getEtag());
            assertEquals(11L, stored.getSize());

            StepVerifier.create(driver.execute(new GetObjectOperation(BUCKET, "dir/Test Object.txt")))
                    .assertNext(data -> {
                        assertEquals("text/plain", data.getMetadata().getContentType());
                        assertEquals("Test Object", read(data.getContent()));
                        // the content stream can be read more than once
                        assertEquals("Test Object", read(data.getContent()));
                    })
                    .verifyComplete();

            StepVerifier.create(driver.execute(new HeadObjectOperation(BUCKET, "dir/Test Object.txt")))
                    .assertNext(head -> assertEquals(stored.getEtag(), head.getEtag()))
                    .verifyComplete();

            StepVerifier.create(driver.execute(new DeleteObjectOperation(BUCKET, "dir/Test Object.txt")))
                    .verifyComplete();
            StepVerifier.create(driver.execute(new HeadObjectOperation(BUCKET, "dir/Test Object.txt")))
                    .expectError(ObjectNotFoundException.class)
                    .verify();
        }

        @Test
        void putKeepsUserMetadataAndDefaultsContentType() {
            driver.execute(PutObjectOperation.builder()
                    .bucketName(BUCKET).key("meta").content(body("x"))
                    .metadata(Map.of("owner", "nimbus"))
                    .build()).block();

            StorageObject head = driver.execute(new HeadObjectOperation(BUCKET, "meta")).block();
            assertNotNull(head);
            assertEquals("application/octet-stream", head.getContentType());
            assertEquals(Map.of("owner", "nimbus"), head.getUserMetadata());
        }

        @Test
        @DisplayName("Content-MD5 不匹配时返回 BadDigest")
        void putWithWrongContentMd5Fails() {
            StepVerifier.create(driver.execute(PutObjectOperation.builder()
                            .bucketName(BUCKET).key("k").content(body("payload"))
                            .contentMd5(EtagUtils.md5Base64("other".getBytes(StandardCharsets.UTF_8)))
                            .build()))
                    .expectError(BadDigestException.class)
                    .verify();

            StepVerifier.create(driver.execute(new HeadObjectOperation(BUCKET, "k")))
                    .expectError(ObjectNotFoundException.class)
                    .verify();
        }

        @Test
        void putIntoMissingBucketFails() {
            StepVerifier.create(driver.execute(PutObjectOperation.builder()
                            .bucketName("missing-bucket").key("k").content(body("x")).build()))
                    .expectError(BucketNotFoundException.class)
                    .verify();
        }

        @Test
        void getMissingKeyAndMissingBucket() {
            StepVerifier.create(driver.execute(new GetObjectOperation(BUCKET, "non-Existent")))
                    .expectError(ObjectNotFoundException.class)
                    .verify();
            StepVerifier.create(driver.execute(new GetObjectOperation("missing-bucket", "k")))
                    .expectError(BucketNotFoundException.class)
                    .verify();
        }

        @Test
        void deleteMissingKeySucceeds() {
            StepVerifier.create(driver.execute(new DeleteObjectOperation(BUCKET, "never-written")))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("列出对象")
    class Listing {

        @BeforeEach
        void seed() {
            for (String key : List.of("a.txt", "photos/2024/1.jpg", "photos/2024/2.jpg", "photos/cover.jpg", "z.txt")) {
                put(key, key);
            }
        }

        private ListBucketResult list(ListObjectsRequest.ListObjectsRequestBuilder builder) {
            return driver.execute(new ListObjectsOperation(builder.bucketName(BUCKET).build())).block();
        }

        @Test
        void listsAllKeysSorted() {
            ListBucketResult result = list(ListObjectsRequest.builder());

            assertEquals(List.of("a.txt", "photos/2024/1.jpg", "photos/2024/2.jpg", "photos/cover.jpg", "z.txt"),
                    result.getContents().stream().map(StorageObject::getKey).toList());
            assertFalse(result.getIsTruncated());
            assertTrue(result.getCommonPrefixes().isEmpty());
        }

        @Test
        @DisplayName("按 delimiter 汇总公共前缀")
        void rollsUpCommonPrefixes() {
            ListBucketResult result = list(ListObjectsRequest.builder().prefix("photos/").delimiter("/"));

            assertEquals(List.of("photos/cover.jpg"),
                    result.getContents().stream().map(StorageObject::getKey).toList());
            assertEquals(List.of("photos/2024/"),
                    result.getCommonPrefixes().stream().map(ListBucketResult.CommonPrefix::getPrefix).toList());
        }

        @Test
        void paginatesWithMarker() {
            ListBucketResult first = list(ListObjectsRequest.builder().maxKeys(2));
            assertTrue(first.getIsTruncated());
            assertEquals(2, first.getContents().size());

            String marker = first.getContents().get(1).getKey();
            ListBucketResult second = list(ListObjectsRequest.builder().marker(marker).maxKeys(10));
            assertEquals(List.of("photos/2024/2.jpg", "photos/cover.jpg", "z.txt"),
                    second.getContents().stream().map(StorageObject::getKey).toList());
        }

        @Test
        void listMissingBucketFails() {
            StepVerifier.create(driver.execute(new ListObjectsOperation(
                            ListObjectsRequest.builder().bucketName("Non-Existent").build())))
                    .expectError(BucketNotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("分片上传")
    class Multipart {

        private String uploadId;

        @BeforeEach
        void start() {
            uploadId = driver.execute(new CreateMultipartUploadOperation(BUCKET, "multi", "text/plain", Map.of()))
                    .block().getUploadId();
        }

        private UploadPart upload(int partNumber, String content) {
            return driver.execute(UploadPartOperation.builder()
                    .bucketName(BUCKET).key("multi").uploadId(uploadId)
                    .partNumber(partNumber).content(body(content))
                    .build()).block();
        }

        private CompleteMultipartUploadOperation complete(List<CompletedPart> parts) {
            return new CompleteMultipartUploadOperation(BUCKET, "multi", uploadId, parts);
        }

        private static CompletedPart part(int number, UploadPart uploaded) {
            return CompletedPart.builder().partNumber(number).etag(EtagUtils.quote(uploaded.getEtag())).build();
        }

        @Test
        void completeConcatenatesListedParts() {
            UploadPart one = upload(1, "part-one|");
            UploadPart two = upload(2, "part-two|");
            UploadPart three = upload(3, "end");

            StorageObject object = driver.execute(complete(List.of(part(1, one), part(2, two), part(3, three))))
                    .block();

            assertNotNull(object);
            assertEquals(EtagUtils.multipartEtag(List.of(one.getEtag(), two.getEtag(), three.getEtag())),
                    object.getEtag());
            assertTrue(object.getEtag().endsWith("-3"));
            assertEquals("part-one|part-two|end",
                    read(driver.execute(new GetObjectOperation(BUCKET, "multi")).block().getContent()));

            StepVerifier.create(driver.execute(new ListPartsOperation(BUCKET, "multi", uploadId)))
                    .expectError(NoSuchUploadException.class)
                    .verify();
        }

        @Test
        void reuploadReplacesPart() {
            upload(1, "first-version");
            UploadPart replaced = upload(1, "second");

            StepVerifier.create(driver.execute(new ListPartsOperation(BUCKET, "multi", uploadId)))
                    .assertNext(result -> {
                        assertEquals(1, result.getParts().size());
                        assertEquals(replaced.getEtag(), result.getParts().get(0).getEtag());
                        assertEquals(6L, result.getParts().get(0).getSize());
                    })
                    .verifyComplete();
        }

        @Test
        void rejectsDescendingParts() {
            UploadPart one = upload(1, "aaaa");
            UploadPart two = upload(2, "bbbb");

            StepVerifier.create(driver.execute(complete(List.of(part(2, two), part(1, one)))))
                    .expectError(InvalidPartOrderException.class)
                    .verify();
        }

        @Test
        void rejectsUnknownPartOrEtag() {
            UploadPart one = upload(1, "aaaa");

            StepVerifier.create(driver.execute(complete(List.of(part(1, one), part(2, one)))))
                    .expectError(InvalidPartException.class)
                    .verify();
            StepVerifier.create(driver.execute(complete(List.of(
                            CompletedPart.builder().partNumber(1).etag("\"0123\"").build()))))
                    .expectError(InvalidPartException.class)
                    .verify();
        }

        @Test
        @DisplayName("非最后分片小于最小分片大小时失败")
        void rejectsSmallNonFinalPart() {
            UploadPart one = upload(1, "ab");
            UploadPart two = upload(2, "cdef");

            StepVerifier.create(driver.execute(complete(List.of(part(1, one), part(2, two)))))
                    .expectError(EntityTooSmallException.class)
                    .verify();
        }

        @Test
        void uploadToUnknownIdFails() {
            StepVerifier.create(driver.execute(UploadPartOperation.builder()
                            .bucketName(BUCKET).key("multi").uploadId("nope")
                            .partNumber(1).content(body("x")).build()))
                    .expectError(NoSuchUploadException.class)
                    .verify();
        }

        @Test
        void rejectsPartNumberOutOfRange() {
            StepVerifier.create(driver.execute(UploadPartOperation.builder()
                            .bucketName(BUCKET).key("multi").uploadId(uploadId)
                            .partNumber(10001).content(body("x")).build()))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }

        @Test
        void abortRemovesUpload() {
            upload(1, "data");

            StepVerifier.create(driver.execute(new AbortMultipartUploadOperation(BUCKET, "multi", uploadId)))
                    .verifyComplete();
            StepVerifier.create(driver.execute(new AbortMultipartUploadOperation(BUCKET, "multi", uploadId)))
                    .expectError(NoSuchUploadException.class)
                    .verify();
        }
    }
}
