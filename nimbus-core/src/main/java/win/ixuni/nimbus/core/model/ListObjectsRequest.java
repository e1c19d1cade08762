package win.ixuni.nimbus.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * ListObjects (V1) 查询条件
 * <p>
 * Raw query values as received; the {@code effective*} accessors give the normalized form
 * drivers page with.
 */
@Value
@Builder
public class ListObjectsRequest {

    public static final int MAX_KEYS_LIMIT = 1000;

    String bucketName;

    String prefix;

    /**
     * No roll-up into common prefixes when null or empty
     */
    String delimiter;

    /**
     * Exclusive start key
     */
    String marker;

    Integer maxKeys;

    public String effectivePrefix() {
        return prefix != null ? prefix : "";
    }

    public String effectiveDelimiter() {
        return delimiter == null || delimiter.isEmpty() ? null : delimiter;
    }

    public String effectiveMarker() {
        return marker != null ? marker : "";
    }

    /**
     * 0..1000, 1000 when absent
     */
    public int effectiveMaxKeys() {
        if (maxKeys == null) {
            return MAX_KEYS_LIMIT;
        }
        return Math.min(Math.max(0, maxKeys), MAX_KEYS_LIMIT);
    }
}
