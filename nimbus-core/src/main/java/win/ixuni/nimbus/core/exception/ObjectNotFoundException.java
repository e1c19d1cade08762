package win.ixuni.nimbus.core.exception;

import lombok.Getter;

/**
 * NoSuchKey (404)
 */
@Getter
public class ObjectNotFoundException extends NimbusException {

    private final String bucketName;
    private final String key;

    public ObjectNotFoundException(String bucketName, String key) {
        super("NoSuchKey", "The specified key does not exist.", 404, objectResource(bucketName, key));
        this.bucketName = bucketName;
        this.key = key;
    }
}
