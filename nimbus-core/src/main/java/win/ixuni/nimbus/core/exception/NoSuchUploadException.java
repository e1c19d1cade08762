package win.ixuni.nimbus.core.exception;

import lombok.Getter;

/**
 * NoSuchUpload (404): unknown id, or an upload that was already completed or aborted.
 */
@Getter
public class NoSuchUploadException extends NimbusException {

    private final String uploadId;

    public NoSuchUploadException(String uploadId) {
        super("NoSuchUpload", "The specified upload does not exist. The upload ID may be invalid, "
                + "or the upload may have been aborted or completed: " + uploadId, 404);
        this.uploadId = uploadId;
    }
}
