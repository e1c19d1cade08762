package win.ixuni.nimbus.core.model;

/**
 * XML namespace of the S3 REST API documents
 */
public final class S3Namespace {

    public static final String URI = "http://s3.amazonaws.com/doc/2006-03-01/";

    private S3Namespace() {
    }
}
