package win.ixuni.nimbus.core.model;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 列出对象返回结果 (ListObjects V1)
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JacksonXmlRootElement(localName = "ListBucketResult", namespace = S3Namespace.URI)
public class ListBucketResult {

    @JacksonXmlProperty(localName = "Name")
    private String bucketName;

    @JacksonXmlProperty(localName = "Prefix")
    private String prefix;

    @JacksonXmlProperty(localName = "Marker")
    private String marker;

    @JacksonXmlProperty(localName = "MaxKeys")
    private Integer maxKeys;

    @JacksonXmlProperty(localName = "Delimiter")
    private String delimiter;

    /**
     * Whether truncated (more data available)
     */
    @JacksonXmlProperty(localName = "IsTruncated")
    private Boolean isTruncated;

    /**
     * Next page marker, set only when truncated
     */
    @JacksonXmlProperty(localName = "NextMarker")
    private String nextMarker;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "Contents")
    private List<StorageObject> contents;

    /**
     * 公共前缀列表（模拟目录）
     */
    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "CommonPrefixes")
    private List<CommonPrefix> commonPrefixes;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CommonPrefix {
        @JacksonXmlProperty(localName = "Prefix")
        private String prefix;
    }
}
