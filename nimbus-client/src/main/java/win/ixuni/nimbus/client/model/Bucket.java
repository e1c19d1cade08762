package win.ixuni.nimbus.client.model;

import lombok.Value;

import java.time.Instant;

@Value
public class Bucket {

    String name;

    Instant creationDate;
}
