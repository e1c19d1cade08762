package win.ixuni.nimbus.client.model;

import lombok.Value;

import java.util.List;

@Value
public class ListPartsResult {

    String uploadId;

    boolean truncated;

    List<PartSummary> parts;
}
