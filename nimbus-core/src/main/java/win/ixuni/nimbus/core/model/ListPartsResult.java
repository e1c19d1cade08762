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
 * List uploaded parts result
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JacksonXmlRootElement(localName = "ListPartsResult", namespace = S3Namespace.URI)
public class ListPartsResult {

    @JacksonXmlProperty(localName = "Bucket")
    private String bucketName;

    @JacksonXmlProperty(localName = "Key")
    private String key;

    @JacksonXmlProperty(localName = "UploadId")
    private String uploadId;

    @JacksonXmlProperty(localName = "PartNumberMarker")
    private Integer partNumberMarker;

    @JacksonXmlProperty(localName = "NextPartNumberMarker")
    private Integer nextPartNumberMarker;

    @JacksonXmlProperty(localName = "MaxParts")
    private Integer maxParts;

    @JacksonXmlProperty(localName = "IsTruncated")
    private Boolean isTruncated;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "Part")
    private List<UploadPart> parts;
}
