package win.ixuni.nimbus.core.exception;

import lombok.Getter;

/**
 * 存储服务异常基类
 * <p>
 * Carries the S3 error code, the HTTP status the service answers with and, when known,
 * the resource ({@code /bucket} or {@code /bucket/key}) the error refers to.
 */
@Getter
public class NimbusException extends RuntimeException {

    private final String errorCode;
    private final int httpStatus;
    private final String resource;

    public NimbusException(String errorCode, String message, int httpStatus) {
        this(errorCode, message, httpStatus, (String) null);
    }

    public NimbusException(String errorCode, String message, int httpStatus, String resource) {
        super(message);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
        this.resource = resource;
    }

    public NimbusException(String errorCode, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
        this.resource = null;
    }

    protected static String bucketResource(String bucketName) {
        return "/" + bucketName;
    }

    protected static String objectResource(String bucketName, String key) {
        return "/" + bucketName + "/" + key;
    }
}
