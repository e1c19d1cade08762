package win.ixuni.nimbus.core.model;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 分片上传的单个分片
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UploadPart {

    /**
     * 分片编号 (1-10000)
     */
    @JacksonXmlProperty(localName = "PartNumber")
    private Integer partNumber;

    @JacksonXmlProperty(localName = "LastModified")
    private Instant lastModified;

    @JacksonXmlProperty(localName = "ETag")
    private String etag;

    /**
     * 分片大小（字节）
     */
    @JacksonXmlProperty(localName = "Size")
    private Long size;
}
