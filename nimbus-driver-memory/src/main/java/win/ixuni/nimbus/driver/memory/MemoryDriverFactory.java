package win.ixuni.nimbus.driver.memory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import win.ixuni.nimbus.core.config.DriverConfig;
import win.ixuni.nimbus.core.driver.DriverFactory;
import win.ixuni.nimbus.core.driver.StorageDriver;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext;

/**
 * Creates {@link MemoryStorageDriver}s and resolves their {@code min-part-size} (bytes, or a
 * size such as {@code 5MB}) and {@code strict-create} properties.
 */
@Slf4j
@Component
public class MemoryDriverFactory implements DriverFactory {

    public static final String DRIVER_TYPE = "memory";

    @Override
    public String getDriverType() {
        return DRIVER_TYPE;
    }

    @Override
    public StorageDriver createDriver(DriverConfig config) {
        long minPartSize = config.getDataSize(MemoryDriverContext.MIN_PART_SIZE_PROPERTY,
                DataSize.ofBytes(MemoryDriverContext.DEFAULT_MIN_PART_SIZE)).toBytes();
        if (minPartSize < 0) {
            throw new IllegalArgumentException("Driver '" + config.getName() + "': "
                    + MemoryDriverContext.MIN_PART_SIZE_PROPERTY + " must not be negative, got " + minPartSize);
        }
        boolean strictCreate = config.getBoolean(MemoryDriverContext.STRICT_CREATE_PROPERTY, false);

        log.info("Creating memory driver '{}' (min-part-size={}, strict-create={})",
                config.getName(), minPartSize, strictCreate);
        return new MemoryStorageDriver(config, minPartSize, strictCreate);
    }

    @Override
    public String getDescription() {
        return "Process-local storage, lost on restart";
    }
}
