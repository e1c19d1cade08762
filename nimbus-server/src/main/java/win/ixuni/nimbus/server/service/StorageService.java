package win.ixuni.nimbus.server.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.driver.StorageDriver;
import win.ixuni.nimbus.core.model.CompletedPart;
import win.ixuni.nimbus.core.model.ListBucketResult;
import win.ixuni.nimbus.core.model.ListObjectsRequest;
import win.ixuni.nimbus.core.model.ListPartsResult;
import win.ixuni.nimbus.core.model.MultipartUpload;
import win.ixuni.nimbus.core.model.StorageBucket;
import win.ixuni.nimbus.core.model.StorageObject;
import win.ixuni.nimbus.core.model.StorageObjectData;
import win.ixuni.nimbus.core.model.UploadPart;
import win.ixuni.nimbus.core.operation.Operation;
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
import win.ixuni.nimbus.server.registry.DriverRegistry;

import java.util.List;
import java.util.Map;

/**
 * Storage service layer
 * <p>
 * Turns controller calls into operations and runs them on the default driver.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StorageService {

    private final DriverRegistry driverRegistry;

    private <R> Mono<R> execute(Operation<R> operation) {
        return Mono.defer(() -> {
            StorageDriver driver = driverRegistry.getDefaultDriver();
            return driver.execute(operation);
        });
    }

    // ==================== Bucket 操作 ====================

    public Mono<StorageBucket> createBucket(String bucketName, String cannedAcl) {
        log.info("Creating bucket: {} (acl: {})", bucketName, cannedAcl);
        return execute(new CreateBucketOperation(bucketName, cannedAcl));
    }

    public Mono<Void> deleteBucket(String bucketName) {
        log.info("Deleting bucket: {}", bucketName);
        return execute(new DeleteBucketOperation(bucketName));
    }

    public Mono<Boolean> bucketExists(String bucketName) {
        return execute(new BucketExistsOperation(bucketName));
    }

    public Mono<List<StorageBucket>> listBuckets() {
        return execute(new ListBucketsOperation());
    }

    // ==================== Object 操作 ====================

    public Mono<StorageObject> putObject(PutObjectOperation operation) {
        log.debug("Putting object: {}/{}", operation.getBucketName(), operation.getKey());
        return execute(operation);
    }

    public Mono<StorageObjectData> getObject(String bucketName, String key) {
        return execute(new GetObjectOperation(bucketName, key));
    }

    public Mono<StorageObject> headObject(String bucketName, String key) {
        return execute(new HeadObjectOperation(bucketName, key));
    }

    public Mono<Void> deleteObject(String bucketName, String key) {
        log.debug("Deleting object: {}/{}", bucketName, key);
        return execute(new DeleteObjectOperation(bucketName, key));
    }

    public Mono<ListBucketResult> listObjects(ListObjectsRequest request) {
        return execute(new ListObjectsOperation(request));
    }

    // ==================== 分片上传 ====================

    public Mono<MultipartUpload> createMultipartUpload(String bucketName, String key, String contentType,
                                                      Map<String, String> metadata) {
        log.info("Creating multipart upload: {}/{}", bucketName, key);
        return execute(new CreateMultipartUploadOperation(bucketName, key, contentType, metadata));
    }

    public Mono<UploadPart> uploadPart(UploadPartOperation operation) {
        log.debug("Uploading part {} of upload {}", operation.getPartNumber(), operation.getUploadId());
        return execute(operation);
    }

    public Mono<StorageObject> completeMultipartUpload(String bucketName, String key, String uploadId,
                                                      List<CompletedPart> parts) {
        log.info("Completing multipart upload {} for {}/{} with {} parts", uploadId, bucketName, key, parts.size());
        return execute(new CompleteMultipartUploadOperation(bucketName, key, uploadId, parts));
    }

    public Mono<Void> abortMultipartUpload(String bucketName, String key, String uploadId) {
        log.info("Aborting multipart upload {} for {}/{}", uploadId, bucketName, key);
        return execute(new AbortMultipartUploadOperation(bucketName, key, uploadId));
    }

    public Mono<ListPartsResult> listParts(String bucketName, String key, String uploadId) {
        return execute(new ListPartsOperation(bucketName, key, uploadId));
    }
}
