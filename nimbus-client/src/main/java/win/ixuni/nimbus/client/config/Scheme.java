package win.ixuni.nimbus.client.config;

/**
 * Transport scheme of the storage endpoint
 */
public enum Scheme {

    HTTP("http"),
    HTTPS("https");

    private final String value;

    Scheme(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
