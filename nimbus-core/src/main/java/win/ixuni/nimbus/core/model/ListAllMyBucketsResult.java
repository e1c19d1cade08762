package win.ixuni.nimbus.core.model;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * ListBuckets response document
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JacksonXmlRootElement(localName = "ListAllMyBucketsResult", namespace = S3Namespace.URI)
public class ListAllMyBucketsResult {

    @JacksonXmlProperty(localName = "Owner")
    private Owner owner;

    @JacksonXmlElementWrapper(localName = "Buckets")
    @JacksonXmlProperty(localName = "Bucket")
    private List<StorageBucket> buckets;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Owner {
        @JacksonXmlProperty(localName = "ID")
        private String id;

        @JacksonXmlProperty(localName = "DisplayName")
        private String displayName;
    }

    public static ListAllMyBucketsResult of(List<StorageBucket> buckets) {
        return new ListAllMyBucketsResult(new Owner("nimbus", "Nimbus"), buckets);
    }
}
