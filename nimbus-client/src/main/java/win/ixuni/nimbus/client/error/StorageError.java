package win.ixuni.nimbus.client.error;

import lombok.Builder;
import lombok.Value;

/**
 * 请求失败详情
 */
@Value
@Builder
public class StorageError {

    StorageErrorType errorType;

    /**
     * Service error code such as {@code NoSuchBucket}, or the exception class for transport failures
     */
    String exceptionName;

    String message;

    /**
     * HTTP status, 0 when no response was received
     */
    int responseCode;

    String requestId;

    boolean retryable;

    public static StorageError fromResponse(int status, String code, String message, String requestId) {
        StorageErrorType type = code != null ? StorageErrorType.fromCode(code) : StorageErrorType.fromHttpStatus(status);
        return StorageError.builder()
                .errorType(type)
                .exceptionName(code != null ? code : "HTTP " + status)
                .message(message != null ? message : "HTTP status " + status)
                .responseCode(status)
                .requestId(requestId)
                .retryable(type.isRetryable() || status >= 500)
                .build();
    }

    public static StorageError fromException(StorageErrorType type, Throwable cause) {
        return StorageError.builder()
                .errorType(type)
                .exceptionName(cause.getClass().getSimpleName())
                .message(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName())
                .responseCode(0)
                .retryable(type.isRetryable())
                .build();
    }
}
