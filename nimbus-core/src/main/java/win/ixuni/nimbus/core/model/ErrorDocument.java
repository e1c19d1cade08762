package win.ixuni.nimbus.core.model;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * S3 error response document
 *
 * <pre>
 * &lt;Error&gt;
 *     &lt;Code&gt;NoSuchBucket&lt;/Code&gt;
 *     &lt;Message&gt;The specified bucket does not exist&lt;/Message&gt;
 *     &lt;Resource&gt;/mybucket&lt;/Resource&gt;
 *     &lt;RequestId&gt;xxx&lt;/RequestId&gt;
 * &lt;/Error&gt;
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JacksonXmlRootElement(localName = "Error")
public class ErrorDocument {

    @JacksonXmlProperty(localName = "Code")
    private String code;

    @JacksonXmlProperty(localName = "Message")
    private String message;

    @JacksonXmlProperty(localName = "Resource")
    private String resource;

    @JacksonXmlProperty(localName = "RequestId")
    private String requestId;

    @JacksonXmlProperty(localName = "HostId")
    private String hostId;
}
