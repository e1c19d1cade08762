package win.ixuni.nimbus.model;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A service response: payload, headers and HTTP status
 *
 * @param <P> payload type
 */
@Getter
public class ServiceResult<P> {

    private final P payload;

    /**
     * Response headers, looked up case-insensitively
     */
    private final Map<String, String> headers;

    private final int statusCode;

    public ServiceResult(P payload, Map<String, String> headers, int statusCode) {
        this.payload = payload;
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        this.headers = Collections.unmodifiableMap(copy);
        this.statusCode = statusCode;
    }

    /**
     * A 200 response without headers
     */
    public static <P> ServiceResult<P> of(P payload) {
        return new ServiceResult<>(payload, Map.of(), 200);
    }

    public String getHeader(String name) {
        return headers.get(name);
    }
}
