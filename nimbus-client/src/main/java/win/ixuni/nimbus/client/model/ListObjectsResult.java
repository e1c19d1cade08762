package win.ixuni.nimbus.client.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ListObjectsResult {

    String name;

    String prefix;

    String marker;

    String nextMarker;

    boolean truncated;

    List<ObjectSummary> contents;

    List<String> commonPrefixes;
}
