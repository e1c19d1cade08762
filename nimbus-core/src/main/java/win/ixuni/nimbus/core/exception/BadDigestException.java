package win.ixuni.nimbus.core.exception;

/**
 * Content-MD5 mismatch exception
 */
public class BadDigestException extends NimbusException {

    public BadDigestException(String expectedMd5) {
        super("BadDigest", "The Content-MD5 you specified did not match what we received: " + expectedMd5, 400);
    }
}
