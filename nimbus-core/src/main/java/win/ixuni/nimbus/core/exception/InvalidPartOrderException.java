package win.ixuni.nimbus.core.exception;

/**
 * Thrown when the completed part list is empty or not strictly ascending.
 */
public class InvalidPartOrderException extends NimbusException {

    public InvalidPartOrderException(String uploadId) {
        super("InvalidPartOrder", "The list of parts was not in ascending order, or is empty: " + uploadId, 400);
    }
}
