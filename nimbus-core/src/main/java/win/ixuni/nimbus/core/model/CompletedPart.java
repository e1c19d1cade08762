package win.ixuni.nimbus.core.model;

import lombok.Builder;
import lombok.Value;
import win.ixuni.nimbus.core.util.EtagUtils;

/**
 * One entry of a CompleteMultipartUpload request
 */
@Value
@Builder
public class CompletedPart {

    Integer partNumber;

    /**
     * ETag as the client listed it, quoted or bare
     */
    String etag;

    /**
     * @param storedEtag bare hex ETag recorded when the part was uploaded
     */
    public boolean matches(String storedEtag) {
        return etag != null && storedEtag != null && EtagUtils.unquote(etag).equalsIgnoreCase(storedEtag);
    }
}
