package win.ixuni.nimbus.core.exception;

/**
 * Thrown when a non-final part is smaller than the minimum part size.
 */
public class EntityTooSmallException extends NimbusException {

    public EntityTooSmallException(int partNumber, long size, long minimum) {
        super("EntityTooSmall",
                "Your proposed upload is smaller than the minimum allowed object size: part " + partNumber
                        + " has " + size + " bytes, minimum is " + minimum,
                400);
    }
}
