package win.ixuni.nimbus.client.model;

/**
 * Canned ACLs accepted on bucket creation
 */
public enum BucketCannedAcl {

    PRIVATE("private"),
    PUBLIC_READ("public-read"),
    PUBLIC_READ_WRITE("public-read-write"),
    AUTHENTICATED_READ("authenticated-read");

    private final String headerValue;

    BucketCannedAcl(String headerValue) {
        this.headerValue = headerValue;
    }

    /**
     * @return value of the {@code x-amz-acl} header
     */
    public String getHeaderValue() {
        return headerValue;
    }
}
