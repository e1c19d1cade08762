package win.ixuni.nimbus.server.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.exception.NimbusException;
import win.ixuni.nimbus.core.model.StorageObject;
import win.ixuni.nimbus.core.operation.object.PutObjectOperation;
import win.ixuni.nimbus.core.util.EtagUtils;
import win.ixuni.nimbus.server.service.StorageService;

import java.util.Map;

import static win.ixuni.nimbus.server.controller.S3RequestSupport.normalizeKey;

/**
 * Object 操作控制器
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ObjectController {

    private final StorageService storageService;

    /**
     * 上传对象
     * PUT /{bucket}/{key}
     */
    @PutMapping("/{bucket}/{*key}")
    public Mono<ResponseEntity<Void>> putObject(
            @PathVariable String bucket,
            @PathVariable String key,
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType,
            @RequestHeader(value = "Content-MD5", required = false) String contentMd5,
            @RequestHeader(value = "x-amz-content-sha256", required = false) String contentSha256,
            @RequestHeader Map<String, String> headers,
            @RequestBody(required = false) Flux<DataBuffer> body) {

        PutObjectOperation operation = PutObjectOperation.builder()
                .bucketName(bucket)
                .key(normalizeKey(key))
                .content(S3RequestSupport.payload(body, contentSha256))
                .contentType(contentType)
                .metadata(S3RequestSupport.userMetadata(headers))
                .contentMd5(contentMd5)
                .build();

        return storageService.putObject(operation)
                .map(object -> ResponseEntity.ok()
                        .eTag(EtagUtils.quote(object.getEtag()))
                        .<Void>build());
    }

    /**
     * 获取对象
     * GET /{bucket}/{key}
     */
    @GetMapping("/{bucket}/{*key}")
    public Mono<ResponseEntity<Flux<DataBuffer>>> getObject(
            @PathVariable String bucket,
            @PathVariable String key) {

        return storageService.getObject(bucket, normalizeKey(key))
                .map(data -> objectHeaders(data.getMetadata())
                        .body(S3RequestSupport.toDataBuffers(data.getContent())));
    }

    /**
     * 获取对象元数据
     * HEAD /{bucket}/{key}
     */
    @RequestMapping(value = "/{bucket}/{*key}", method = RequestMethod.HEAD)
    public Mono<ResponseEntity<Void>> headObject(
            @PathVariable String bucket,
            @PathVariable String key) {

        return storageService.headObject(bucket, normalizeKey(key))
                .map(object -> objectHeaders(object).<Void>build())
                .onErrorResume(NimbusException.class,
                        e -> Mono.just(ResponseEntity.status(e.getHttpStatus()).<Void>build()));
    }

    /**
     * 删除对象
     * DELETE /{bucket}/{key}
     */
    @DeleteMapping("/{bucket}/{*key}")
    public Mono<ResponseEntity<Void>> deleteObject(
            @PathVariable String bucket,
            @PathVariable String key) {

        return storageService.deleteObject(bucket, normalizeKey(key))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    private ResponseEntity.BodyBuilder objectHeaders(StorageObject object) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, object.getContentType())
                .header(HttpHeaders.CONTENT_LENGTH, String.valueOf(object.getSize()))
                .header(HttpHeaders.ETAG, EtagUtils.quote(object.getEtag()))
                .header(HttpHeaders.LAST_MODIFIED, S3RequestSupport.httpDate(object.getLastModified()));
        return S3RequestSupport.withUserMetadata(builder, object.getUserMetadata());
    }
}
