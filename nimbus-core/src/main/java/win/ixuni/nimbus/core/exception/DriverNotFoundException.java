package win.ixuni.nimbus.core.exception;

import java.util.Collection;

/**
 * The service is configured to route requests to a driver that was never created.
 * Reported to callers as InternalError.
 */
public class DriverNotFoundException extends NimbusException {

    public DriverNotFoundException(String driverName, Collection<String> available) {
        super("InternalError", "No storage driver named '" + driverName + "' (configured: " + available + ")", 500);
    }
}
