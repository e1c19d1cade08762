package win.ixuni.nimbus.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Bucket 模型
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageBucket {

    /**
     * Bucket名称
     */
    @JacksonXmlProperty(localName = "Name")
    private String name;

    /**
     * Creation time
     */
    @JacksonXmlProperty(localName = "CreationDate")
    private Instant creationDate;

    /**
     * Canned ACL recorded at creation (not serialized)
     */
    @JsonIgnore
    private String cannedAcl;

    /**
     * Owning driver instance name (not serialized)
     */
    @JsonIgnore
    private String driverName;
}
