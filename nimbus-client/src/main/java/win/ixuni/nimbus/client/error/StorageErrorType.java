package win.ixuni.nimbus.client.error;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 存储错误类型
 * <p>
 * Service error codes plus the transport conditions the client detects itself.
 */
public enum StorageErrorType {

    NO_SUCH_BUCKET("NoSuchBucket", false),
    NO_SUCH_KEY("NoSuchKey", false),
    NO_SUCH_UPLOAD("NoSuchUpload", false),
    BUCKET_ALREADY_EXISTS("BucketAlreadyExists", false),
    BUCKET_NOT_EMPTY("BucketNotEmpty", false),
    INVALID_BUCKET_NAME("InvalidBucketName", false),
    INVALID_PART("InvalidPart", false),
    INVALID_PART_ORDER("InvalidPartOrder", false),
    ENTITY_TOO_SMALL("EntityTooSmall", false),
    BAD_DIGEST("BadDigest", false),
    INVALID_ARGUMENT("InvalidArgument", false),
    ACCESS_DENIED("AccessDenied", false),
    NOT_IMPLEMENTED("NotImplemented", false),
    INTERNAL_FAILURE("InternalError", true),
    SERVICE_UNAVAILABLE("ServiceUnavailable", true),
    THROTTLING("SlowDown", true),

    RESOURCE_NOT_FOUND(null, false),
    NETWORK_CONNECTION(null, true),
    REQUEST_TIMEOUT("RequestTimeout", true),
    UNKNOWN(null, false);

    private static final Map<String, StorageErrorType> BY_CODE = Arrays.stream(values())
            .filter(type -> type.code != null)
            .collect(Collectors.toUnmodifiableMap(type -> type.code, Function.identity()));

    private final String code;
    private final boolean retryable;

    StorageErrorType(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    /**
     * Service error code, null for client-side conditions
     */
    public String getCode() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Map a service error code to its type
     *
     * @param code the {@code <Code>} of an error document
     * @return matching type, or {@link #UNKNOWN}
     */
    public static StorageErrorType fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        return switch (code) {
            case "BucketAlreadyOwnedByYou" -> BUCKET_ALREADY_EXISTS;
            case "InternalFailure" -> INTERNAL_FAILURE;
            case "Throttling", "ThrottlingException", "TooManyRequests" -> THROTTLING;
            default -> BY_CODE.getOrDefault(code, UNKNOWN);
        };
    }

    /**
     * Classify a response that carried no error document
     */
    public static StorageErrorType fromHttpStatus(int status) {
        if (status == 404) {
            return RESOURCE_NOT_FOUND;
        }
        if (status == 403) {
            return ACCESS_DENIED;
        }
        if (status == 429) {
            return THROTTLING;
        }
        if (status == 503) {
            return SERVICE_UNAVAILABLE;
        }
        if (status >= 500) {
            return INTERNAL_FAILURE;
        }
        return UNKNOWN;
    }
}
