package win.ixuni.nimbus.client.model;

import lombok.Value;

import java.time.Instant;

@Value
public class ObjectSummary {

    String key;

    String etag;

    long size;

    Instant lastModified;
}
