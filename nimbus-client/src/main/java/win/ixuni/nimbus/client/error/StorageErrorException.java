package win.ixuni.nimbus.client.error;

import lombok.Getter;

/**
 * Carries a {@link StorageError} through the reactive pipeline until it becomes a failed outcome
 */
@Getter
public class StorageErrorException extends RuntimeException {

    private final StorageError error;

    public StorageErrorException(StorageError error) {
        super(error.getExceptionName() + ": " + error.getMessage());
        this.error = error;
    }
}
