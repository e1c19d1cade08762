package win.ixuni.nimbus.server.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.model.CompleteMultipartUpload;
import win.ixuni.nimbus.core.model.CompleteMultipartUploadResult;
import win.ixuni.nimbus.core.model.CompletedPart;
import win.ixuni.nimbus.core.model.InitiateMultipartUploadResult;
import win.ixuni.nimbus.core.model.ListPartsResult;
import win.ixuni.nimbus.core.operation.multipart.UploadPartOperation;
import win.ixuni.nimbus.core.util.EtagUtils;
import win.ixuni.nimbus.server.service.StorageService;

import java.util.List;
import java.util.Map;

import static win.ixuni.nimbus.server.controller.S3RequestSupport.APPLICATION_XML;
import static win.ixuni.nimbus.server.controller.S3RequestSupport.normalizeKey;

/**
 * 分片上传控制器
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class MultipartUploadController {

    private final StorageService storageService;

    /**
     * 创建分片上传
     * POST /{bucket}/{key}?uploads
     */
    @PostMapping(value = "/{bucket}/{*key}", params = "uploads", produces = APPLICATION_XML)
    public Mono<ResponseEntity<InitiateMultipartUploadResult>> createMultipartUpload(
            @PathVariable String bucket,
            @PathVariable String key,
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType,
            @RequestHeader Map<String, String> headers) {

        String normalizedKey = normalizeKey(key);
        return storageService.createMultipartUpload(bucket, normalizedKey, contentType,
                        S3RequestSupport.userMetadata(headers))
                .map(upload -> ResponseEntity.ok(InitiateMultipartUploadResult.of(upload)));
    }

    /**
     * 上传分片
     * PUT /{bucket}/{key}?partNumber={partNumber}&uploadId={uploadId}
     */
    @PutMapping(value = "/{bucket}/{*key}", params = {"partNumber", "uploadId"})
    public Mono<ResponseEntity<Void>> uploadPart(
            @PathVariable String bucket,
            @PathVariable String key,
            @RequestParam Integer partNumber,
            @RequestParam String uploadId,
            @RequestHeader(value = "Content-MD5", required = false) String contentMd5,
            @RequestHeader(value = "x-amz-content-sha256", required = false) String contentSha256,
            @RequestBody(required = false) Flux<DataBuffer> body) {

        UploadPartOperation operation = UploadPartOperation.builder()
                .bucketName(bucket)
                .key(normalizeKey(key))
                .uploadId(uploadId)
                .partNumber(partNumber)
                .content(S3RequestSupport.payload(body, contentSha256))
                .contentMd5(contentMd5)
                .build();

        return storageService.uploadPart(operation)
                .map(part -> ResponseEntity.ok()
                        .eTag(EtagUtils.quote(part.getEtag()))
                        .<Void>build());
    }

    /**
     * 完成分片上传
     * POST /{bucket}/{key}?uploadId={uploadId}
     */
    @PostMapping(value = "/{bucket}/{*key}", params = "uploadId", produces = APPLICATION_XML)
    public Mono<ResponseEntity<CompleteMultipartUploadResult>> completeMultipartUpload(
            @PathVariable String bucket,
            @PathVariable String key,
            @RequestParam String uploadId,
            @RequestBody CompleteMultipartUpload request) {

        String normalizedKey = normalizeKey(key);
        List<CompletedPart> parts = request.getParts().stream()
                .map(p -> CompletedPart.builder()
                        .partNumber(p.getPartNumber())
                        .etag(EtagUtils.unquote(p.getEtag()))
                        .build())
                .toList();

        return storageService.completeMultipartUpload(bucket, normalizedKey, uploadId, parts)
                .map(object -> ResponseEntity.ok(CompleteMultipartUploadResult.of(object)));
    }

    /**
     * 取消分片上传
     * DELETE /{bucket}/{key}?uploadId={uploadId}
     */
    @DeleteMapping(value = "/{bucket}/{*key}", params = "uploadId")
    public Mono<ResponseEntity<Void>> abortMultipartUpload(
            @PathVariable String bucket,
            @PathVariable String key,
            @RequestParam String uploadId) {

        return storageService.abortMultipartUpload(bucket, normalizeKey(key), uploadId)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    /**
     * List uploaded parts
     * GET /{bucket}/{key}?uploadId={uploadId}
     */
    @GetMapping(value = "/{bucket}/{*key}", params = "uploadId", produces = APPLICATION_XML)
    public Mono<ResponseEntity<ListPartsResult>> listParts(
            @PathVariable String bucket,
            @PathVariable String key,
            @RequestParam String uploadId) {

        return storageService.listParts(bucket, normalizeKey(key), uploadId)
                .map(result -> result.toBuilder()
                        .parts(result.getParts().stream()
                                .map(part -> part.toBuilder().etag(EtagUtils.quote(part.getEtag())).build())
                                .toList())
                        .build())
                .map(ResponseEntity::ok);
    }
}
