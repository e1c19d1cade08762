package win.ixuni.nimbus.client.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Parts to assemble, in ascending part number order
 */
@Value
@Builder
public class CompletedMultipartUpload {

    @Singular
    List<CompletedPart> parts;
}
