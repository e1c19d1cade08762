package win.ixuni.nimbus.client.util;

import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Path-style request URL builder
 */
public final class S3Paths {

    private S3Paths() {
    }

    /**
     * Encode a key segment by segment so that {@code /} separators survive
     */
    public static String encodeKey(String key) {
        return Arrays.stream(key.split("/", -1))
                .map(segment -> UriUtils.encodePathSegment(segment, StandardCharsets.UTF_8))
                .collect(Collectors.joining("/"));
    }

    public static String bucketPath(String bucket) {
        return "/" + UriUtils.encodePathSegment(bucket, StandardCharsets.UTF_8);
    }

    public static String objectPath(String bucket, String key) {
        return bucketPath(bucket) + "/" + encodeKey(key);
    }

    /**
     * Append query parameters; null values are skipped and empty values are written as a bare name ({@code ?uploads})
     */
    public static String withQuery(String path, Map<String, String> params) {
        StringBuilder sb = new StringBuilder(path);
        char separator = '?';
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            sb.append(separator).append(encodeQueryParam(entry.getKey()));
            if (!entry.getValue().isEmpty()) {
                sb.append('=').append(encodeQueryParam(entry.getValue()));
            }
            separator = '&';
        }
        return sb.toString();
    }

    /**
     * RFC 3986 query encoding plus {@code +}, which the server would otherwise read back as a space
     */
    static String encodeQueryParam(String value) {
        return UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8).replace("+", "%2B");
    }

    public static Map<String, String> query() {
        return new LinkedHashMap<>();
    }
}
