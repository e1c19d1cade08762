package win.ixuni.nimbus.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Object 模型
 * <p>
 * Inside the service the ETag is the bare hex digest; it is quoted only when written to the wire.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StorageObject {

    /**
     * 对象Key
     */
    @JacksonXmlProperty(localName = "Key")
    private String key;

    /**
     * Owning bucket (internal use)
     */
    @JsonIgnore
    private String bucketName;

    /**
     * 对象大小(字节)
     */
    @JacksonXmlProperty(localName = "Size")
    private Long size;

    @JacksonXmlProperty(localName = "ETag")
    private String etag;

    @JacksonXmlProperty(localName = "LastModified")
    private Instant lastModified;

    /**
     * Content type (not serialized in list responses)
     */
    @JsonIgnore
    private String contentType;

    /**
     * User-defined metadata (not serialized in list responses)
     */
    @JsonIgnore
    private Map<String, String> userMetadata;

    @JacksonXmlProperty(localName = "StorageClass")
    @Builder.Default
    private String storageClass = "STANDARD";
}
