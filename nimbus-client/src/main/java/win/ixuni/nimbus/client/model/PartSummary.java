package win.ixuni.nimbus.client.model;

import lombok.Value;

import java.time.Instant;

@Value
public class PartSummary {

    int partNumber;

    String etag;

    long size;

    Instant lastModified;
}
