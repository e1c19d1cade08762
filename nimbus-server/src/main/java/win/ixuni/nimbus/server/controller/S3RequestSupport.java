package win.ixuni.nimbus.server.controller;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Flux;
import win.ixuni.nimbus.core.util.AwsChunkedDecoder;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Request/response helpers shared by the S3 controllers
 */
final class S3RequestSupport {

    static final String APPLICATION_XML = "application/xml";
    static final String META_PREFIX = "x-amz-meta-";

    private static final DateTimeFormatter HTTP_DATE_FORMATTER = DateTimeFormatter
            .ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US)
            .withZone(ZoneOffset.UTC);

    private S3RequestSupport() {
    }

    /**
     * Spring's {@code {*key}} capture starts with '/'
     */
    static String normalizeKey(String key) {
        if (key == null || key.isEmpty()) {
            return "";
        }
        return key.startsWith("/") ? key.substring(1) : key;
    }

    /**
     * x-amz-meta-* headers without the prefix
     */
    static Map<String, String> userMetadata(Map<String, String> headers) {
        Map<String, String> metadata = new HashMap<>();
        headers.forEach((name, value) -> {
            if (name.toLowerCase(Locale.ROOT).startsWith(META_PREFIX)) {
                metadata.put(name.substring(META_PREFIX.length()).toLowerCase(Locale.ROOT), value);
            }
        });
        return metadata;
    }

    /**
     * Request body as payload bytes, decoding aws-chunked bodies
     */
    static Flux<ByteBuffer> payload(Flux<DataBuffer> body, String contentSha256) {
        Flux<DataBuffer> safeBody = body != null ? body : Flux.empty();
        if (AwsChunkedDecoder.isAwsChunkedEncoding(contentSha256)) {
            return AwsChunkedDecoder.decode(safeBody);
        }
        return safeBody.map(dataBuffer -> {
            byte[] bytes = new byte[dataBuffer.readableByteCount()];
            dataBuffer.read(bytes);
            DataBufferUtils.release(dataBuffer);
            return ByteBuffer.wrap(bytes);
        });
    }

    static Flux<DataBuffer> toDataBuffers(Flux<ByteBuffer> content) {
        return content.map(DefaultDataBufferFactory.sharedInstance::wrap);
    }

    static String httpDate(Instant instant) {
        return HTTP_DATE_FORMATTER.format(instant);
    }

    static <B extends ResponseEntity.HeadersBuilder<B>> B withUserMetadata(B builder, Map<String, String> metadata) {
        if (metadata != null) {
            metadata.forEach((name, value) -> builder.header(META_PREFIX + name, value));
        }
        return builder;
    }
}
