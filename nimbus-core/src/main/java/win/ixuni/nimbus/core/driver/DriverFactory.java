package win.ixuni.nimbus.core.driver;

import win.ixuni.nimbus.core.config.DriverConfig;

/**
 * Creates drivers of one type
 * <p>
 * Factories are Spring beans; the server matches each {@code nimbus.drivers} entry to the
 * factory whose {@link #getDriverType()} equals the entry's {@code type}.
 */
public interface DriverFactory {

    String getDriverType();

    /**
     * @throws IllegalArgumentException when the entry's properties are invalid for this type
     */
    StorageDriver createDriver(DriverConfig config);

    default String getDescription() {
        return getDriverType() + " storage driver";
    }
}
