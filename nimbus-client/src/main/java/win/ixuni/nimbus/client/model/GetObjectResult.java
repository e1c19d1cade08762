package win.ixuni.nimbus.client.model;

import lombok.Builder;
import lombok.Value;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

/**
 * 下载对象结果
 */
@Value
@Builder
public class GetObjectResult {

    String etag;

    String contentType;

    long contentLength;

    Instant lastModified;

    Map<String, String> metadata;

    /**
     * Buffered body, null when it was written to a response stream
     */
    byte[] content;

    /**
     * @return the buffered body, or an empty stream when a response stream factory received it
     */
    public InputStream getBody() {
        return content != null ? new ByteArrayInputStream(content) : InputStream.nullInputStream();
    }

    public String getBodyAsString() {
        return content != null ? new String(content, StandardCharsets.UTF_8) : "";
    }
}
