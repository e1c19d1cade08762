package win.ixuni.nimbus.core.exception;

/**
 * Invalid part exception
 * <p>
 * One of the parts named in a complete request was never uploaded, or its ETag does not match.
 */
public class InvalidPartException extends NimbusException {

    public InvalidPartException(String uploadId, int partNumber) {
        super("InvalidPart",
                "One or more of the specified parts could not be found: upload " + uploadId + ", part " + partNumber,
                400);
    }
}
