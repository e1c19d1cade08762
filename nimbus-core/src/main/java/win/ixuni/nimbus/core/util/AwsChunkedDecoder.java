package win.ixuni.nimbus.core.util;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import reactor.core.publisher.Flux;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * aws-chunked 请求体解码器
 * <p>
 * Clients that stream signed payloads send bodies of the form
 *
 * <pre>
 * &lt;size-hex&gt;;chunk-signature=&lt;sig&gt;\r\n
 * &lt;data&gt;\r\n
 * ...
 * 0;chunk-signature=&lt;sig&gt;\r\n
 * [trailers]\r\n
 * </pre>
 * <p>
 * The decoder drops chunk headers, signatures and trailers and emits only payload bytes.
 */
public final class AwsChunkedDecoder {

    private static final String STREAMING_PREFIX = "STREAMING-";

    private AwsChunkedDecoder() {
    }

    /**
     * @param contentSha256 value of x-amz-content-sha256
     * @return true when the body is aws-chunked
     */
    public static boolean isAwsChunkedEncoding(String contentSha256) {
        return contentSha256 != null && contentSha256.startsWith(STREAMING_PREFIX);
    }

    /**
     * Decode an aws-chunked request body
     *
     * @param input raw request body
     * @return payload stream
     */
    public static Flux<ByteBuffer> decode(Flux<DataBuffer> input) {
        return DataBufferUtils.join(input)
                .flatMapMany(joined -> {
                    byte[] bytes = new byte[joined.readableByteCount()];
                    joined.read(bytes);
                    DataBufferUtils.release(joined);
                    return Flux.fromIterable(decodeChunks(bytes));
                });
    }

    /**
     * Decode a fully buffered aws-chunked body
     *
     * @param data encoded bytes
     * @return payload bytes
     */
    public static byte[] decode(byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length);
        for (ByteBuffer chunk : decodeChunks(data)) {
            out.write(chunk.array(), chunk.arrayOffset() + chunk.position(), chunk.remaining());
        }
        return out.toByteArray();
    }

    static List<ByteBuffer> decodeChunks(byte[] data) {
        List<ByteBuffer> result = new ArrayList<>();
        int pos = 0;

        while (pos < data.length) {
            int headerEnd = indexOfCrlf(data, pos);
            if (headerEnd == -1) {
                throw new IllegalArgumentException("Malformed aws-chunked body: missing chunk header terminator");
            }

            int chunkSize = parseChunkSize(new String(data, pos, headerEnd - pos, StandardCharsets.US_ASCII));
            if (chunkSize == 0) {
                // trailers follow the final chunk
                break;
            }

            int dataStart = headerEnd + 2;
            if (chunkSize > data.length - dataStart) {
                throw new IllegalArgumentException("Malformed aws-chunked body: chunk of " + chunkSize
                        + " bytes exceeds remaining " + (data.length - dataStart) + " bytes");
            }
            result.add(ByteBuffer.wrap(data, dataStart, chunkSize).slice());
            pos = dataStart + chunkSize + 2;
        }

        return result;
    }

    private static int parseChunkSize(String headerLine) {
        int semicolon = headerLine.indexOf(';');
        String sizeHex = semicolon >= 0 ? headerLine.substring(0, semicolon) : headerLine;
        try {
            int size = Integer.parseInt(sizeHex.trim(), 16);
            if (size < 0) {
                throw new IllegalArgumentException("Malformed aws-chunked size: " + headerLine);
            }
            return size;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed aws-chunked size: " + headerLine, e);
        }
    }

    private static int indexOfCrlf(byte[] data, int offset) {
        for (int i = offset; i < data.length - 1; i++) {
            if (data[i] == '\r' && data[i + 1] == '\n') {
                return i;
            }
        }
        return -1;
    }
}
