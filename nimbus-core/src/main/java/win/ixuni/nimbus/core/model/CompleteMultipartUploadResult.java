package win.ixuni.nimbus.core.model;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.nimbus.core.util.EtagUtils;

/**
 * {@code <CompleteMultipartUploadResult>}: the assembled object, with its {@code <md5>-<parts>} ETag
 */
@Data
@NoArgsConstructor
@JacksonXmlRootElement(localName = "CompleteMultipartUploadResult", namespace = S3Namespace.URI)
public class CompleteMultipartUploadResult {

    /**
     * Path-style location, {@code /bucket/key}
     */
    @JacksonXmlProperty(localName = "Location")
    private String location;

    @JacksonXmlProperty(localName = "Bucket")
    private String bucket;

    @JacksonXmlProperty(localName = "Key")
    private String key;

    @JacksonXmlProperty(localName = "ETag")
    private String etag;

    public static CompleteMultipartUploadResult of(StorageObject object) {
        CompleteMultipartUploadResult result = new CompleteMultipartUploadResult();
        result.setLocation("/" + object.getBucketName() + "/" + object.getKey());
        result.setBucket(object.getBucketName());
        result.setKey(object.getKey());
        result.setEtag(EtagUtils.quote(object.getEtag()));
        return result;
    }
}
