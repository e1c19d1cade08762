package win.ixuni.nimbus.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.ProxyProvider;
import reactor.util.retry.Retry;
import win.ixuni.nimbus.client.config.ClientConfiguration;
import win.ixuni.nimbus.client.error.StorageError;
import win.ixuni.nimbus.client.error.StorageErrorException;
import win.ixuni.nimbus.client.error.StorageErrorType;
import win.ixuni.nimbus.client.limiter.RateLimiter;
import win.ixuni.nimbus.client.model.*;
import win.ixuni.nimbus.client.util.S3Paths;
import win.ixuni.nimbus.core.model.CompleteMultipartUpload;
import win.ixuni.nimbus.core.model.ErrorDocument;
import win.ixuni.nimbus.core.model.InitiateMultipartUploadResult;
import win.ixuni.nimbus.core.model.ListAllMyBucketsResult;
import win.ixuni.nimbus.core.model.ListBucketResult;
import win.ixuni.nimbus.core.util.XmlMappers;

import java.io.IOException;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 存储客户端
 * <p>
 * 以 path-style 访问 S3 REST API。每个操作都有阻塞版本和 {@code *Async} 版本，均不抛出异常，
 * 失败以 {@link Outcome} 返回。可重试的失败（5xx、限流、连接错误、超时）按指数退避重试。
 */
@Slf4j
public class StorageClient implements AutoCloseable {

    private static final String META_PREFIX = "x-amz-meta-";
    private static final String REQUEST_ID_HEADER = "x-amz-request-id";
    private static final int BODY_CHUNK_SIZE = 64 * 1024;
    private static final int MAX_DOCUMENT_SIZE = 16 * 1024 * 1024;

    private final ClientConfiguration config;
    private final ConnectionProvider connectionProvider;
    private final WebClient webClient;
    private final XmlMapper xmlMapper = XmlMappers.create();

    public StorageClient(ClientConfiguration config) {
        this.config = config;
        this.connectionProvider = ConnectionProvider.builder("nimbus-client")
                .maxConnections(config.getMaxConnections())
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.getConnectTimeout().toMillis())
                .responseTimeout(config.getRequestTimeout());
        if (config.hasProxy()) {
            httpClient = httpClient.proxy(proxy -> proxy.type(ProxyProvider.Proxy.HTTP)
                    .host(config.getProxyHost())
                    .port(config.getProxyPort()));
        }

        this.webClient = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_DOCUMENT_SIZE))
                .defaultHeader(HttpHeaders.USER_AGENT, config.getUserAgent())
                .build();

        log.info("Storage client created for {} (max retries: {})", config.baseUrl(), config.getMaxRetries());
    }

    // ==================== Bucket ====================

    public Outcome<CreateBucketResult> createBucket(CreateBucketRequest request) {
        return createBucketAsync(request).join();
    }

    public CompletableFuture<Outcome<CreateBucketResult>> createBucketAsync(CreateBucketRequest request) {
        return execute("CreateBucket", () -> {
            String path = S3Paths.bucketPath(request.getBucket());
            return exchange(HttpMethod.PUT, path, headers -> {
                if (request.getAcl() != null) {
                    headers.set("x-amz-acl", request.getAcl().getHeaderValue());
                }
            }, null, response -> {
                String location = response.headers().asHttpHeaders().getFirst(HttpHeaders.LOCATION);
                return response.releaseBody().thenReturn(new CreateBucketResult(location != null ? location : path));
            });
        });
    }

    public Outcome<Void> headBucket(HeadBucketRequest request) {
        return headBucketAsync(request).join();
    }

    public CompletableFuture<Outcome<Void>> headBucketAsync(HeadBucketRequest request) {
        return execute("HeadBucket", () -> exchange(HttpMethod.HEAD,
                S3Paths.bucketPath(request.getBucket()), noHeaders(), null, ClientResponse::releaseBody));
    }

    public Outcome<Void> deleteBucket(DeleteBucketRequest request) {
        return deleteBucketAsync(request).join();
    }

    public CompletableFuture<Outcome<Void>> deleteBucketAsync(DeleteBucketRequest request) {
        return execute("DeleteBucket", () -> exchange(HttpMethod.DELETE,
                S3Paths.bucketPath(request.getBucket()), noHeaders(), null, ClientResponse::releaseBody));
    }

    public Outcome<ListBucketsResult> listBuckets() {
        return listBucketsAsync().join();
    }

    public CompletableFuture<Outcome<ListBucketsResult>> listBucketsAsync() {
        return execute("ListBuckets", () -> exchange(HttpMethod.GET, "/", noHeaders(), null,
                response -> readDocument(response, ListAllMyBucketsResult.class)
                        .map(document -> new ListBucketsResult(document.getBuckets() == null ? List.of()
                                : document.getBuckets().stream()
                                .map(bucket -> new Bucket(bucket.getName(), bucket.getCreationDate()))
                                .toList()))));
    }

    // ==================== Object ====================

    public Outcome<PutObjectResult> putObject(PutObjectRequest request) {
        return putObjectAsync(request).join();
    }

    public CompletableFuture<Outcome<PutObjectResult>> putObjectAsync(PutObjectRequest request) {
        return execute("PutObject", () -> exchange(HttpMethod.PUT,
                S3Paths.objectPath(request.getBucket(), request.getKey()),
                headers -> {
                    headers.setContentLength(request.effectiveContentLength());
                    if (request.getContentType() != null) {
                        headers.set(HttpHeaders.CONTENT_TYPE, request.getContentType());
                    }
                    if (request.getContentMd5() != null) {
                        headers.set("Content-MD5", request.getContentMd5());
                    }
                    request.getMetadata().forEach((name, value) -> headers.set(META_PREFIX + name, value));
                },
                request.getBody(),
                response -> response.releaseBody()
                        .thenReturn(new PutObjectResult(response.headers().asHttpHeaders().getETag()))));
    }

    public Outcome<GetObjectResult> getObject(GetObjectRequest request) {
        return getObjectAsync(request).join();
    }

    public CompletableFuture<Outcome<GetObjectResult>> getObjectAsync(GetObjectRequest request) {
        return execute("GetObject", () -> exchange(HttpMethod.GET,
                S3Paths.objectPath(request.getBucket(), request.getKey()), noHeaders(), null,
                response -> {
                    HttpHeaders headers = response.headers().asHttpHeaders();
                    GetObjectResult.GetObjectResultBuilder result = GetObjectResult.builder()
                            .etag(headers.getETag())
                            .contentType(headers.getFirst(HttpHeaders.CONTENT_TYPE))
                            .contentLength(headers.getContentLength())
                            .lastModified(lastModified(headers))
                            .metadata(userMetadata(headers));
                    Flux<DataBuffer> body = response.bodyToFlux(DataBuffer.class)
                            .delayUntil(buffer -> throttle(config.getReadRateLimiter(), buffer.readableByteCount()));

                    if (request.getResponseStreamFactory() != null) {
                        return writeTo(request.getResponseStreamFactory(), body)
                                .then(Mono.fromSupplier(result::build));
                    }
                    return DataBufferUtils.join(body)
                            .map(StorageClient::toBytes)
                            .defaultIfEmpty(new byte[0])
                            .map(content -> result.content(content).build());
                }));
    }

    public Outcome<HeadObjectResult> headObject(HeadObjectRequest request) {
        return headObjectAsync(request).join();
    }

    public CompletableFuture<Outcome<HeadObjectResult>> headObjectAsync(HeadObjectRequest request) {
        return execute("HeadObject", () -> exchange(HttpMethod.HEAD,
                S3Paths.objectPath(request.getBucket(), request.getKey()), noHeaders(), null,
                response -> {
                    HttpHeaders headers = response.headers().asHttpHeaders();
                    HeadObjectResult result = HeadObjectResult.builder()
                            .etag(headers.getETag())
                            .contentLength(headers.getContentLength())
                            .contentType(headers.getFirst(HttpHeaders.CONTENT_TYPE))
                            .lastModified(lastModified(headers))
                            .metadata(userMetadata(headers))
                            .build();
                    return response.releaseBody().thenReturn(result);
                }));
    }

    public Outcome<Void> deleteObject(DeleteObjectRequest request) {
        return deleteObjectAsync(request).join();
    }

    public CompletableFuture<Outcome<Void>> deleteObjectAsync(DeleteObjectRequest request) {
        return execute("DeleteObject", () -> exchange(HttpMethod.DELETE,
                S3Paths.objectPath(request.getBucket(), request.getKey()), noHeaders(), null,
                ClientResponse::releaseBody));
    }

    public Outcome<ListObjectsResult> listObjects(ListObjectsRequest request) {
        return listObjectsAsync(request).join();
    }

    public CompletableFuture<Outcome<ListObjectsResult>> listObjectsAsync(ListObjectsRequest request) {
        return execute("ListObjects", () -> {
            Map<String, String> query = S3Paths.query();
            query.put("prefix", request.getPrefix());
            query.put("delimiter", request.getDelimiter());
            query.put("marker", request.getMarker());
            query.put("max-keys", request.getMaxKeys() != null ? String.valueOf(request.getMaxKeys()) : null);
            String path = S3Paths.withQuery(S3Paths.bucketPath(request.getBucket()), query);

            return exchange(HttpMethod.GET, path, noHeaders(), null,
                    response -> readDocument(response, ListBucketResult.class).map(StorageClient::toListObjectsResult));
        });
    }

    // ==================== Multipart ====================

    public Outcome<CreateMultipartUploadResult> createMultipartUpload(CreateMultipartUploadRequest request) {
        return createMultipartUploadAsync(request).join();
    }

    public CompletableFuture<Outcome<CreateMultipartUploadResult>> createMultipartUploadAsync(
            CreateMultipartUploadRequest request) {
        return execute("CreateMultipartUpload", () -> {
            Map<String, String> query = S3Paths.query();
            query.put("uploads", "");
            String path = S3Paths.withQuery(S3Paths.objectPath(request.getBucket(), request.getKey()), query);

            return exchange(HttpMethod.POST, path, headers -> {
                if (request.getContentType() != null) {
                    headers.set(HttpHeaders.CONTENT_TYPE, request.getContentType());
                }
                request.getMetadata().forEach((name, value) -> headers.set(META_PREFIX + name, value));
            }, null, response -> readDocument(response, InitiateMultipartUploadResult.class)
                    .map(document -> new CreateMultipartUploadResult(
                            document.getBucket(), document.getKey(), document.getUploadId())));
        });
    }

    public Outcome<UploadPartResult> uploadPart(UploadPartRequest request) {
        return uploadPartAsync(request).join();
    }

    public CompletableFuture<Outcome<UploadPartResult>> uploadPartAsync(UploadPartRequest request) {
        return execute("UploadPart", () -> {
            Map<String, String> query = S3Paths.query();
            query.put("partNumber", String.valueOf(request.getPartNumber()));
            query.put("uploadId", request.getUploadId());
            String path = S3Paths.withQuery(S3Paths.objectPath(request.getBucket(), request.getKey()), query);

            return exchange(HttpMethod.PUT, path, headers -> {
                headers.setContentLength(request.effectiveContentLength());
                if (request.getContentMd5() != null) {
                    headers.set("Content-MD5", request.getContentMd5());
                }
            }, request.getBody(), response -> response.releaseBody()
                    .thenReturn(new UploadPartResult(response.headers().asHttpHeaders().getETag())));
        });
    }

    public Outcome<CompleteMultipartUploadResult> completeMultipartUpload(CompleteMultipartUploadRequest request) {
        return completeMultipartUploadAsync(request).join();
    }

    public CompletableFuture<Outcome<CompleteMultipartUploadResult>> completeMultipartUploadAsync(
            CompleteMultipartUploadRequest request) {
        return execute("CompleteMultipartUpload", () -> {
            Map<String, String> query = S3Paths.query();
            query.put("uploadId", request.getUploadId());
            String path = S3Paths.withQuery(S3Paths.objectPath(request.getBucket(), request.getKey()), query);

            return exchange(HttpMethod.POST, path,
                    headers -> headers.setContentType(MediaType.APPLICATION_XML),
                    writeDocument(toCompleteDocument(request.getMultipartUpload())),
                    response -> readDocument(response, win.ixuni.nimbus.core.model.CompleteMultipartUploadResult.class)
                            .map(document -> new CompleteMultipartUploadResult(document.getLocation(),
                                    document.getBucket(), document.getKey(), document.getEtag())));
        });
    }

    public Outcome<Void> abortMultipartUpload(AbortMultipartUploadRequest request) {
        return abortMultipartUploadAsync(request).join();
    }

    public CompletableFuture<Outcome<Void>> abortMultipartUploadAsync(AbortMultipartUploadRequest request) {
        return execute("AbortMultipartUpload", () -> {
            Map<String, String> query = S3Paths.query();
            query.put("uploadId", request.getUploadId());
            String path = S3Paths.withQuery(S3Paths.objectPath(request.getBucket(), request.getKey()), query);
            return exchange(HttpMethod.DELETE, path, noHeaders(), null, ClientResponse::releaseBody);
        });
    }

    public Outcome<ListPartsResult> listParts(ListPartsRequest request) {
        return listPartsAsync(request).join();
    }

    public CompletableFuture<Outcome<ListPartsResult>> listPartsAsync(ListPartsRequest request) {
        return execute("ListParts", () -> {
            Map<String, String> query = S3Paths.query();
            query.put("uploadId", request.getUploadId());
            String path = S3Paths.withQuery(S3Paths.objectPath(request.getBucket(), request.getKey()), query);

            return exchange(HttpMethod.GET, path, noHeaders(), null,
                    response -> readDocument(response, win.ixuni.nimbus.core.model.ListPartsResult.class)
                            .map(document -> new ListPartsResult(document.getUploadId(),
                                    Boolean.TRUE.equals(document.getIsTruncated()),
                                    document.getParts() == null ? List.of() : document.getParts().stream()
                                            .map(part -> new PartSummary(part.getPartNumber(), part.getEtag(),
                                                    part.getSize() != null ? part.getSize() : 0L, part.getLastModified()))
                                            .toList())));
        });
    }

    @Override
    public void close() {
        connectionProvider.dispose();
        log.debug("Storage client for {} closed", config.baseUrl());
    }

    // ==================== Pipeline ====================

    /**
     * Turn a call into an outcome: translate transport errors, retry what is retryable, never fail the future
     */
    private <R> CompletableFuture<Outcome<R>> execute(String operation, Supplier<Mono<R>> call) {
        return Mono.defer(call)
                .onErrorMap(e -> !(e instanceof StorageErrorException), this::translateTransportError)
                .retryWhen(retrySpec(operation))
                .map(result -> Outcome.success(result))
                .defaultIfEmpty(Outcome.success(null))
                .onErrorResume(e -> Mono.just(Outcome.<R>failure(toStorageError(e))))
                .doOnNext(outcome -> {
                    if (!outcome.isSuccess()) {
                        logFailure(operation, outcome.getError());
                    }
                })
                .toFuture();
    }

    private <R> Mono<R> exchange(HttpMethod method, String pathAndQuery, Consumer<HttpHeaders> headers,
                                 byte[] body, Function<ClientResponse, Mono<R>> onSuccess) {
        URI uri = URI.create(config.baseUrl() + pathAndQuery);
        WebClient.RequestBodySpec spec = webClient.method(method).uri(uri).headers(headers);
        WebClient.RequestHeadersSpec<?> request = body != null
                ? spec.body(requestBody(body), ByteBuffer.class)
                : spec;

        return request.exchangeToMono(response -> response.statusCode().value() >= 300
                ? errorFrom(response)
                : onSuccess.apply(response));
    }

    private Retry retrySpec(String operation) {
        return Retry.backoff(config.getMaxRetries(), config.getRetryBaseDelay())
                .filter(e -> e instanceof StorageErrorException se && se.getError().isRetryable())
                .doBeforeRetry(signal -> log.warn("{} failed ({}), retry {}/{}", operation,
                        signal.failure().getMessage(), signal.totalRetries() + 1, config.getMaxRetries()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    /**
     * Request body split into chunks, each one paced by the write limiter
     */
    private Flux<ByteBuffer> requestBody(byte[] body) {
        int chunks = (body.length + BODY_CHUNK_SIZE - 1) / BODY_CHUNK_SIZE;
        return Flux.range(0, chunks)
                .map(index -> {
                    int offset = index * BODY_CHUNK_SIZE;
                    return ByteBuffer.wrap(body, offset, Math.min(BODY_CHUNK_SIZE, body.length - offset)).slice();
                })
                .delayUntil(chunk -> throttle(config.getWriteRateLimiter(), chunk.remaining()));
    }

    private static Mono<Void> throttle(RateLimiter limiter, long bytes) {
        if (limiter == null) {
            return Mono.empty();
        }
        Duration delay = limiter.applyCost(bytes);
        return delay.isZero() ? Mono.empty() : Mono.delay(delay).then();
    }

    private Mono<Void> writeTo(Supplier<OutputStream> streamFactory, Flux<DataBuffer> body) {
        return Mono.using(streamFactory::get,
                out -> DataBufferUtils.write(body.publishOn(Schedulers.boundedElastic()), out)
                        .map(DataBufferUtils::release)
                        .then(),
                this::closeStream);
    }

    private void closeStream(OutputStream out) {
        try {
            out.close();
        } catch (IOException e) {
            log.warn("Failed to close response stream: {}", e.getMessage());
        }
    }

    private <R> Mono<R> errorFrom(ClientResponse response) {
        int status = response.statusCode().value();
        String requestId = response.headers().asHttpHeaders().getFirst(REQUEST_ID_HEADER);
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.<R>error(new StorageErrorException(toError(status, body, requestId))));
    }

    private StorageError toError(int status, String body, String requestId) {
        if (body.isBlank()) {
            return StorageError.fromResponse(status, null, null, requestId);
        }
        try {
            ErrorDocument document = xmlMapper.readValue(body, ErrorDocument.class);
            return StorageError.fromResponse(status, document.getCode(), document.getMessage(),
                    document.getRequestId() != null ? document.getRequestId() : requestId);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable error body (HTTP {}): {}", status, e.getOriginalMessage());
            return StorageError.fromResponse(status, null, null, requestId);
        }
    }

    private StorageErrorException translateTransportError(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return new StorageErrorException(StorageError.fromException(classify(e), root));
    }

    private static StorageErrorType classify(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ConnectException) {
                return StorageErrorType.NETWORK_CONNECTION;
            }
            if (t instanceof TimeoutException || t instanceof io.netty.handler.timeout.TimeoutException) {
                return StorageErrorType.REQUEST_TIMEOUT;
            }
            if (t == t.getCause()) {
                break;
            }
        }
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof IOException || t instanceof WebClientRequestException) {
                return StorageErrorType.NETWORK_CONNECTION;
            }
            if (t == t.getCause()) {
                break;
            }
        }
        return StorageErrorType.UNKNOWN;
    }

    private static StorageError toStorageError(Throwable e) {
        if (e instanceof StorageErrorException se) {
            return se.getError();
        }
        return StorageError.fromException(StorageErrorType.UNKNOWN, e);
    }

    private static void logFailure(String operation, StorageError error) {
        if (error.getResponseCode() >= 400 && error.getResponseCode() < 500) {
            log.debug("{} failed: {} (HTTP {}) {}", operation, error.getErrorType(), error.getResponseCode(), error.getMessage());
        } else {
            log.warn("{} failed: {} (HTTP {}) {}", operation, error.getErrorType(), error.getResponseCode(), error.getMessage());
        }
    }

    // ==================== Documents ====================

    private <T> Mono<T> readDocument(ClientResponse response, Class<T> type) {
        return response.bodyToMono(String.class)
                .map(xml -> {
                    try {
                        return xmlMapper.readValue(xml, type);
                    } catch (JsonProcessingException e) {
                        throw new IllegalStateException("Malformed " + type.getSimpleName() + " document", e);
                    }
                });
    }

    private byte[] writeDocument(Object document) {
        try {
            return xmlMapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + document.getClass().getSimpleName(), e);
        }
    }

    private static CompleteMultipartUpload toCompleteDocument(CompletedMultipartUpload upload) {
        CompleteMultipartUpload document = new CompleteMultipartUpload();
        upload.getParts().forEach(part -> document.getParts()
                .add(new CompleteMultipartUpload.PartInfo(part.getPartNumber(), part.getEtag())));
        return document;
    }

    private static ListObjectsResult toListObjectsResult(ListBucketResult document) {
        return ListObjectsResult.builder()
                .name(document.getBucketName())
                .prefix(document.getPrefix())
                .marker(document.getMarker())
                .nextMarker(document.getNextMarker())
                .truncated(Boolean.TRUE.equals(document.getIsTruncated()))
                .contents(document.getContents() == null ? List.of() : document.getContents().stream()
                        .map(object -> new ObjectSummary(object.getKey(), object.getEtag(),
                                object.getSize() != null ? object.getSize() : 0L, object.getLastModified()))
                        .toList())
                .commonPrefixes(document.getCommonPrefixes() == null ? List.of() : document.getCommonPrefixes().stream()
                        .map(ListBucketResult.CommonPrefix::getPrefix)
                        .toList())
                .build();
    }

    private static byte[] toBytes(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    private static Instant lastModified(HttpHeaders headers) {
        long millis = headers.getLastModified();
        return millis >= 0 ? Instant.ofEpochMilli(millis) : null;
    }

    private static Map<String, String> userMetadata(HttpHeaders headers) {
        Map<String, String> metadata = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.startsWith(META_PREFIX) && !values.isEmpty()) {
                metadata.put(lower.substring(META_PREFIX.length()), values.get(0));
            }
        });
        return metadata;
    }

    private static Consumer<HttpHeaders> noHeaders() {
        return headers -> {
        };
    }
}
