package win.ixuni.nimbus.client;

import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.netty.http.server.HttpServerRequest;
import win.ixuni.nimbus.client.config.ClientConfiguration;
import win.ixuni.nimbus.client.error.StorageErrorType;
import win.ixuni.nimbus.client.limiter.RateLimiter;
import win.ixuni.nimbus.client.model.GetObjectRequest;
import win.ixuni.nimbus.client.model.GetObjectResult;
import win.ixuni.nimbus.client.model.HeadBucketRequest;
import win.ixuni.nimbus.client.model.ListObjectsRequest;
import win.ixuni.nimbus.client.model.ListObjectsResult;
import win.ixuni.nimbus.client.model.PutObjectRequest;
import win.ixuni.nimbus.client.model.PutObjectResult;
import win.ixuni.nimbus.client.util.HashingUtils;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StorageClient against a stub HTTP server
 */
class StorageClientTest {

    private static final String NO_SUCH_BUCKET_XML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <Error>
              <Code>NoSuchBucket</Code>
              <Message>The specified bucket does not exist</Message>
              <Resource>/missing-bucket</Resource>
              <RequestId>4442587FB7D0A2F9</RequestId>
            </Error>""";

    private static final String LISTING_XML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <ListBucketResult xmlns="http://s3.amazonaws.com/doc/2006-03-01/">
              <Name>listing</Name>
              <Prefix>docs/</Prefix>
              <MaxKeys>1000</MaxKeys>
              <Delimiter>/</Delimiter>
              <IsTruncated>false</IsTruncated>
              <Contents>
                <Key>docs/a.txt</Key>
                <LastModified>2024-01-01T00:00:00Z</LastModified>
                <ETag>"900150983cd24fb0d6963f7d28e17f72"</ETag>
                <Size>3</Size>
                <StorageClass>STANDARD</StorageClass>
              </Contents>
              <CommonPrefixes>
                <Prefix>docs/sub/</Prefix>
              </CommonPrefixes>
            </ListBucketResult>""";

    private static final AtomicInteger flakyAttempts = new AtomicInteger();
    private static final AtomicInteger brokenAttempts = new AtomicInteger();
    private static final AtomicInteger absentAttempts = new AtomicInteger();
    private static final AtomicReference<String> lastPutUri = new AtomicReference<>();
    private static final AtomicReference<HttpHeaders> lastPutHeaders = new AtomicReference<>();
    private static final AtomicReference<String> lastListingUri = new AtomicReference<>();

    private static DisposableServer server;
    private static StorageClient client;

    @BeforeAll
    static void startServer() {
        server = HttpServer.create()
                .host("localhost")
                .port(0)
                .route(routes -> routes
                        .route(request(HttpMethod.GET, "/missing-bucket"), (req, res) -> res.status(404)
                                .header("Content-Type", "application/xml")
                                .header("x-amz-request-id", "4442587FB7D0A2F9")
                                .sendString(Mono.just(NO_SUCH_BUCKET_XML)))
                        .route(request(HttpMethod.HEAD, "/absent"), (req, res) -> {
                            absentAttempts.incrementAndGet();
                            return res.status(404).send();
                        })
                        .route(request(HttpMethod.HEAD, "/flaky"), (req, res) ->
                                flakyAttempts.incrementAndGet() < 3 ? res.status(503).send() : res.status(200).send())
                        .route(request(HttpMethod.HEAD, "/broken"), (req, res) -> {
                            brokenAttempts.incrementAndGet();
                            return res.status(500).send();
                        })
                        .route(request(HttpMethod.HEAD, "/slow"), (req, res) ->
                                Mono.delay(Duration.ofSeconds(3)).then(res.status(200).send().then()))
                        .route(request(HttpMethod.GET, "/listing"), (req, res) -> {
                            lastListingUri.set(req.uri());
                            return res.status(200)
                                    .header("Content-Type", "application/xml")
                                    .sendString(Mono.just(LISTING_XML));
                        })
                        .route(request(HttpMethod.PUT, "/bucket/"), (req, res) -> req.receive()
                                .aggregate()
                                .asByteArray()
                                .defaultIfEmpty(new byte[0])
                                .flatMap(body -> {
                                    lastPutUri.set(req.uri());
                                    lastPutHeaders.set(req.requestHeaders().copy());
                                    return res.status(200)
                                            .header("ETag", HashingUtils.quotedEtag(body))
                                            .send()
                                            .then();
                                }))
                        .route(request(HttpMethod.GET, "/bucket/"), (req, res) -> res.status(200)
                                .header("Content-Type", "text/plain")
                                .header("ETag", HashingUtils.quotedEtag(bytes("Test Object")))
                                .header("x-amz-meta-color", "blue")
                                .sendString(Mono.just("Test Object"))))
                .bindNow();

        client = new StorageClient(config(2));
    }

    @AfterAll
    static void stopServer() {
        client.close();
        server.disposeNow();
    }

    @Test
    @DisplayName("XML 错误体按错误码解析")
    void parsesErrorDocument() {
        Outcome<ListObjectsResult> outcome = client.listObjects(ListObjectsRequest.builder().bucket("missing-bucket").build());

        assertFalse(outcome.isSuccess());
        assertEquals(StorageErrorType.NO_SUCH_BUCKET, outcome.getError().getErrorType());
        assertEquals("NoSuchBucket", outcome.getError().getExceptionName());
        assertEquals(404, outcome.getError().getResponseCode());
        assertEquals("4442587FB7D0A2F9", outcome.getError().getRequestId());
    }

    @Test
    @DisplayName("HEAD 404 无响应体映射为 RESOURCE_NOT_FOUND 且不重试")
    void bodilessNotFoundIsNotRetried() {
        Outcome<Void> outcome = client.headBucket(new HeadBucketRequest("absent"));

        assertEquals(StorageErrorType.RESOURCE_NOT_FOUND, outcome.getError().getErrorType());
        assertEquals(1, absentAttempts.get());
    }

    @Test
    void retriesServiceUnavailableUntilSuccess() {
        Outcome<Void> outcome = client.headBucket(new HeadBucketRequest("flaky"));

        assertTrue(outcome.isSuccess());
        assertEquals(3, flakyAttempts.get());
    }

    @Test
    void givesUpAfterMaxRetries() {
        Outcome<Void> outcome = client.headBucket(new HeadBucketRequest("broken"));

        assertEquals(StorageErrorType.INTERNAL_FAILURE, outcome.getError().getErrorType());
        assertTrue(outcome.getError().isRetryable());
        assertEquals(3, brokenAttempts.get());
    }

    @Test
    void slowResponseTimesOut() {
        try (StorageClient impatient = new StorageClient(config(0).toBuilder()
                .requestTimeout(Duration.ofMillis(300))
                .build())) {
            Outcome<Void> outcome = impatient.headBucket(new HeadBucketRequest("slow"));

            assertEquals(StorageErrorType.REQUEST_TIMEOUT, outcome.getError().getErrorType());
            assertEquals(0, outcome.getError().getResponseCode());
        }
    }

    @Test
    @DisplayName("连接失败映射为 NETWORK_CONNECTION")
    void refusedConnectionIsNetworkError() {
        DisposableServer closed = HttpServer.create().host("localhost").port(0).bindNow();
        int port = closed.port();
        closed.disposeNow();

        try (StorageClient unreachable = new StorageClient(config(0).toBuilder()
                .endpoint("localhost:" + port)
                .build())) {
            Outcome<Void> outcome = unreachable.headBucket(new HeadBucketRequest("any"));

            assertEquals(StorageErrorType.NETWORK_CONNECTION, outcome.getError().getErrorType());
            assertTrue(outcome.getError().isRetryable());
        }
    }

    @Test
    void putObjectSendsBodyAndHeaders() {
        byte[] body = bytes("Test Object");

        Outcome<PutObjectResult> outcome = client.putObject(PutObjectRequest.builder()
                .bucket("bucket")
                .key("docs/my file.txt")
                .body(body)
                .contentMd5(HashingUtils.contentMd5(body))
                .contentType("text/plain")
                .metadataEntry("color", "blue")
                .build());

        assertTrue(outcome.isSuccess());
        assertEquals(HashingUtils.quotedEtag(body), outcome.getResult().getEtag());
        assertEquals("/bucket/docs/my%20file.txt", lastPutUri.get());
        HttpHeaders received = lastPutHeaders.get();
        assertEquals(HashingUtils.contentMd5(body), received.get("Content-MD5"));
        assertEquals("blue", received.get("x-amz-meta-color"));
        assertEquals("11", received.get("Content-Length"));
    }

    @Test
    void getObjectBuffersBodyAndMetadata() {
        Outcome<GetObjectResult> outcome = client.getObject(GetObjectRequest.builder()
                .bucket("bucket")
                .key("test.txt")
                .build());

        GetObjectResult result = outcome.getResult();
        assertEquals("Test Object", result.getBodyAsString());
        assertEquals(HashingUtils.quotedEtag(bytes("Test Object")), result.getEtag());
        assertEquals("blue", result.getMetadata().get("color"));
    }

    @Test
    @DisplayName("responseStreamFactory 接收响应体并在完成后关闭")
    void getObjectWritesIntoResponseStream() {
        TrackingOutputStream sink = new TrackingOutputStream();

        Outcome<GetObjectResult> outcome = client.getObject(GetObjectRequest.builder()
                .bucket("bucket")
                .key("test.txt")
                .responseStreamFactory(() -> sink)
                .build());

        assertTrue(outcome.isSuccess());
        assertEquals("Test Object", sink.toString(StandardCharsets.UTF_8));
        assertTrue(sink.closed);
        assertEquals("", outcome.getResult().getBodyAsString());
    }

    @Test
    void listObjectsParsesDocument() {
        Outcome<ListObjectsResult> outcome = client.listObjects(ListObjectsRequest.builder()
                .bucket("listing")
                .prefix("docs/")
                .delimiter("/")
                .build());

        ListObjectsResult result = outcome.getResult();
        assertEquals(1, result.getContents().size());
        assertEquals("docs/a.txt", result.getContents().get(0).getKey());
        assertEquals(3, result.getContents().get(0).getSize());
        assertEquals("\"900150983cd24fb0d6963f7d28e17f72\"", result.getContents().get(0).getEtag());
        assertEquals(List.of("docs/sub/"), result.getCommonPrefixes());
        assertFalse(result.isTruncated());
        assertTrue(lastListingUri.get().contains("prefix=docs/"));
        assertTrue(lastListingUri.get().contains("delimiter=/"));
    }

    @Test
    void listingQueryKeepsPlusSigns() {
        Outcome<ListObjectsResult> outcome = client.listObjects(ListObjectsRequest.builder()
                .bucket("listing")
                .prefix("a+b/")
                .marker("a+b/one")
                .build());

        assertTrue(outcome.isSuccess());
        assertTrue(lastListingUri.get().contains("prefix=a%2Bb/"), lastListingUri.get());
        assertTrue(lastListingUri.get().contains("marker=a%2Bb/one"), lastListingUri.get());
    }

    @Test
    @DisplayName("未设置 body 时发送空请求体")
    void putObjectWithoutBodySendsEmptyPayload() {
        Outcome<PutObjectResult> outcome = client.putObject(PutObjectRequest.builder()
                .bucket("bucket")
                .key("empty.txt")
                .build());

        assertTrue(outcome.isSuccess(), () -> String.valueOf(outcome));
        assertEquals(HashingUtils.quotedEtag(new byte[0]), outcome.getResult().getEtag());
        assertEquals("0", lastPutHeaders.get().get("Content-Length"));
    }

    @Test
    @DisplayName("请求体经写限速器，响应体经读限速器")
    void bodiesArePacedThroughLimiters() {
        RecordingRateLimiter readLimiter = new RecordingRateLimiter();
        RecordingRateLimiter writeLimiter = new RecordingRateLimiter();
        byte[] body = new byte[200_000];

        try (StorageClient limited = new StorageClient(config(0).toBuilder()
                .readRateLimiter(readLimiter)
                .writeRateLimiter(writeLimiter)
                .build())) {
            assertTrue(limited.putObject(PutObjectRequest.builder()
                    .bucket("bucket")
                    .key("large.bin")
                    .body(body)
                    .build()).isSuccess());
            assertEquals(body.length, writeLimiter.total.get());
            assertEquals(0, readLimiter.total.get());

            Outcome<GetObjectResult> outcome = limited.getObject(GetObjectRequest.builder()
                    .bucket("bucket")
                    .key("test.txt")
                    .build());
            assertEquals("Test Object", outcome.getResult().getBodyAsString());
            assertEquals(bytes("Test Object").length, readLimiter.total.get());
            assertEquals(body.length, writeLimiter.total.get());
        }
    }

    private static ClientConfiguration config(int maxRetries) {
        return ClientConfiguration.builder()
                .endpoint("localhost:" + server.port())
                .connectTimeout(Duration.ofSeconds(2))
                .requestTimeout(Duration.ofSeconds(5))
                .maxRetries(maxRetries)
                .retryBaseDelay(Duration.ofMillis(10))
                .build();
    }

    private static Predicate<HttpServerRequest> request(HttpMethod method, String pathPrefix) {
        return req -> req.method().equals(method) && req.uri().startsWith(pathPrefix);
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static class RecordingRateLimiter implements RateLimiter {

        private final AtomicLong total = new AtomicLong();

        @Override
        public Duration applyCost(long cost) {
            total.addAndGet(cost);
            return Duration.ZERO;
        }

        @Override
        public long getRate() {
            return Long.MAX_VALUE;
        }

        @Override
        public void setRate(long bytesPerSecond) {
        }
    }

    private static class TrackingOutputStream extends ByteArrayOutputStream {

        private volatile boolean closed;

        @Override
        public void close() {
            closed = true;
        }
    }
}
