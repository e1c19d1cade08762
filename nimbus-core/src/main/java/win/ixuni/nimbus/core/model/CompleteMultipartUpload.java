package win.ixuni.nimbus.core.model;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Complete multipart upload request document
 * 
 * <pre>
 * &lt;CompleteMultipartUpload&gt;
 *     &lt;Part&gt;
 *         &lt;PartNumber&gt;1&lt;/PartNumber&gt;
 *         &lt;ETag&gt;"etag1"&lt;/ETag&gt;
 *     &lt;/Part&gt;
 * &lt;/CompleteMultipartUpload&gt;
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JacksonXmlRootElement(localName = "CompleteMultipartUpload", namespace = S3Namespace.URI)
public class CompleteMultipartUpload {

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "Part")
    private List<PartInfo> parts = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PartInfo {
        @JacksonXmlProperty(localName = "PartNumber")
        private Integer partNumber;

        @JacksonXmlProperty(localName = "ETag")
        private String etag;
    }
}
