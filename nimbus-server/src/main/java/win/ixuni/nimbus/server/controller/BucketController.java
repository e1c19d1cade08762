package win.ixuni.nimbus.server.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.config.NimbusProperties;
import win.ixuni.nimbus.core.exception.NimbusException;
import win.ixuni.nimbus.core.model.ListAllMyBucketsResult;
import win.ixuni.nimbus.core.model.ListBucketResult;
import win.ixuni.nimbus.core.model.ListObjectsRequest;
import win.ixuni.nimbus.core.model.StorageObject;
import win.ixuni.nimbus.core.util.EtagUtils;
import win.ixuni.nimbus.server.service.StorageService;

import static win.ixuni.nimbus.server.controller.S3RequestSupport.APPLICATION_XML;

/**
 * Bucket 操作控制器
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class BucketController {

    private static final String BUCKET_REGION_HEADER = "x-amz-bucket-region";

    private final StorageService storageService;
    private final NimbusProperties properties;

    /**
     * List all buckets
     * GET /
     */
    @GetMapping(value = "/", produces = APPLICATION_XML)
    public Mono<ResponseEntity<ListAllMyBucketsResult>> listBuckets() {
        return storageService.listBuckets()
                .map(buckets -> ResponseEntity.ok(ListAllMyBucketsResult.of(buckets)));
    }

    /**
     * 创建Bucket
     * PUT /{bucket}
     */
    @PutMapping("/{bucket}")
    public Mono<ResponseEntity<Void>> createBucket(
            @PathVariable String bucket,
            @RequestHeader(value = "x-amz-acl", required = false) String cannedAcl) {
        return storageService.createBucket(bucket, cannedAcl)
                .map(created -> ResponseEntity.ok()
                        .header(HttpHeaders.LOCATION, "/" + created.getName())
                        .<Void>build());
    }

    /**
     * 删除Bucket
     * DELETE /{bucket}
     */
    @DeleteMapping("/{bucket}")
    public Mono<ResponseEntity<Void>> deleteBucket(@PathVariable String bucket) {
        return storageService.deleteBucket(bucket)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    /**
     * 检查Bucket是否存在
     * HEAD /{bucket}
     */
    @RequestMapping(value = "/{bucket}", method = RequestMethod.HEAD)
    public Mono<ResponseEntity<Void>> headBucket(@PathVariable String bucket) {
        return storageService.bucketExists(bucket)
                .map(exists -> exists
                        ? ResponseEntity.ok().header(BUCKET_REGION_HEADER, properties.getRegion()).<Void>build()
                        : ResponseEntity.notFound().<Void>build())
                .onErrorResume(NimbusException.class,
                        e -> Mono.just(ResponseEntity.status(e.getHttpStatus()).<Void>build()));
    }

    /**
     * 列出Bucket中的对象 (V1)
     * GET /{bucket}
     */
    @GetMapping(value = "/{bucket}", produces = APPLICATION_XML)
    public Mono<ResponseEntity<ListBucketResult>> listObjects(
            @PathVariable String bucket,
            @RequestParam(required = false) String prefix,
            @RequestParam(required = false) String delimiter,
            @RequestParam(required = false) String marker,
            @RequestParam(name = "max-keys", required = false, defaultValue = "1000") Integer maxKeys) {

        ListObjectsRequest request = ListObjectsRequest.builder()
                .bucketName(bucket)
                .prefix(prefix)
                .delimiter(delimiter)
                .marker(marker)
                .maxKeys(maxKeys)
                .build();

        return storageService.listObjects(request)
                .map(result -> result.toBuilder()
                        .contents(result.getContents().stream().map(BucketController::quoteEtag).toList())
                        .build())
                .map(ResponseEntity::ok);
    }

    private static StorageObject quoteEtag(StorageObject object) {
        return object.toBuilder().etag(EtagUtils.quote(object.getEtag())).build();
    }
}
