package win.ixuni.nimbus.model;

/**
 * Payload is not valid JSON or does not have the shape a model expects
 */
public class ModelParseException extends RuntimeException {

    public ModelParseException(String message) {
        super(message);
    }

    public ModelParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
