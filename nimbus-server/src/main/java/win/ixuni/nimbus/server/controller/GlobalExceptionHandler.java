package win.ixuni.nimbus.server.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.exception.NimbusException;
import win.ixuni.nimbus.core.model.ErrorDocument;

import java.util.UUID;

/**
 * Global exception handler
 * <p>
 * Converts exceptions to S3 {@code <Error>} documents.
 */
@Slf4j
@RestControllerAdvice(basePackages = "win.ixuni.nimbus")
public class GlobalExceptionHandler {

    @ExceptionHandler(NimbusException.class)
    public Mono<ResponseEntity<ErrorDocument>> handleNimbusException(NimbusException ex, ServerHttpRequest request) {
        if (ex.getHttpStatus() >= 500) {
            log.error("Storage error: {} - {}", ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            log.warn("Storage error: {} - {}", ex.getErrorCode(), ex.getMessage());
        }
        return error(ex.getHttpStatus(), ex.getErrorCode(), ex.getMessage(),
                ex.getResource() != null ? ex.getResource() : request.getPath().value());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorDocument>> handleResponseStatus(
            ResponseStatusException ex, ServerHttpRequest request) {
        int status = ex.getStatusCode().value();
        log.warn("Rejected request {} {}: {}", request.getMethod(), request.getPath().value(), ex.getReason());
        String code = switch (status) {
            case 405 -> "MethodNotAllowed";
            case 404 -> "NoSuchResource";
            default -> "InvalidRequest";
        };
        return error(status, code, ex.getReason() != null ? ex.getReason() : ex.getMessage(), request.getPath().value());
    }

    @ExceptionHandler({IllegalArgumentException.class, ServerWebInputException.class, DecodingException.class})
    public Mono<ResponseEntity<ErrorDocument>> handleInvalidArgument(Exception ex, ServerHttpRequest request) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST.value(), "InvalidArgument", ex.getMessage(), request.getPath().value());
    }

    @ExceptionHandler(UnsupportedOperationException.class)
    public Mono<ResponseEntity<ErrorDocument>> handleUnsupportedOperation(
            UnsupportedOperationException ex, ServerHttpRequest request) {
        log.warn("Unsupported operation: {}", ex.getMessage());
        return error(HttpStatus.NOT_IMPLEMENTED.value(), "NotImplemented",
                ex.getMessage() != null ? ex.getMessage() : "The requested feature is not implemented",
                request.getPath().value());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorDocument>> handleGenericException(Exception ex, ServerHttpRequest request) {
        log.error("Internal error: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR.value(), "InternalError",
                "We encountered an internal error. Please try again.", request.getPath().value());
    }

    private Mono<ResponseEntity<ErrorDocument>> error(int status, String code, String message, String resource) {
        ErrorDocument error = ErrorDocument.builder()
                .code(code)
                .message(message)
                .resource(resource)
                .requestId(generateRequestId())
                .build();

        return Mono.just(ResponseEntity
                .status(status)
                .header("x-amz-request-id", error.getRequestId())
                .contentType(MediaType.APPLICATION_XML)
                .body(error));
    }

    private String generateRequestId() {
        return UUID.randomUUID().toString().replace("-", "").toUpperCase().substring(0, 16);
    }
}
