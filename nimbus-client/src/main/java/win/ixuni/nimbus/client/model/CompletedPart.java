package win.ixuni.nimbus.client.model;

import lombok.Value;

@Value
public class CompletedPart {

    int partNumber;

    String etag;
}
