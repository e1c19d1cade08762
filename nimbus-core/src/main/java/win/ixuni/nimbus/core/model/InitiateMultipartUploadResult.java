package win.ixuni.nimbus.core.model;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {@code <InitiateMultipartUploadResult>}: answer to {@code POST /{bucket}/{key}?uploads}
 */
@Data
@NoArgsConstructor
@JacksonXmlRootElement(localName = "InitiateMultipartUploadResult", namespace = S3Namespace.URI)
public class InitiateMultipartUploadResult {

    @JacksonXmlProperty(localName = "Bucket")
    private String bucket;

    @JacksonXmlProperty(localName = "Key")
    private String key;

    @JacksonXmlProperty(localName = "UploadId")
    private String uploadId;

    public static InitiateMultipartUploadResult of(MultipartUpload upload) {
        InitiateMultipartUploadResult result = new InitiateMultipartUploadResult();
        result.setBucket(upload.getBucketName());
        result.setKey(upload.getKey());
        result.setUploadId(upload.getUploadId());
        return result;
    }
}
