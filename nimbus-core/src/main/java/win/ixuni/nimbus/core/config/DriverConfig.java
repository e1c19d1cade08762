package win.ixuni.nimbus.core.config;

import lombok.Data;
import org.springframework.util.unit.DataSize;

import java.util.HashMap;
import java.util.Map;

/**
 * One entry of {@code nimbus.drivers}
 * <p>
 * {@link #properties} holds the driver-specific settings, as bound from YAML (numbers,
 * booleans or strings).
 */
@Data
public class DriverConfig {

    /**
     * Instance name, unique across the service
     */
    private String name;

    /**
     * Matched against {@code DriverFactory#getDriverType()}
     */
    private String type;

    private boolean enabled = true;

    private Map<String, Object> properties = new HashMap<>();

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        return value instanceof Boolean flag ? flag : Boolean.parseBoolean(value.toString().trim());
    }

    /**
     * Byte size property: a plain number of bytes or a size string such as {@code 5MB}
     */
    public DataSize getDataSize(String key, DataSize defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return DataSize.ofBytes(number.longValue());
        }
        try {
            return DataSize.parse(value.toString().trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Driver '" + name + "': property " + key
                    + " is not a byte size: " + value, e);
        }
    }
}
