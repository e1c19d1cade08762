package win.ixuni.nimbus.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Nimbus 主配置
 */
@Data
@ConfigurationProperties(prefix = "nimbus")
public class NimbusProperties {

    /**
     * Driver instances to create at startup
     */
    private List<DriverConfig> drivers = new ArrayList<>();

    /**
     * Name of the driver instance that serves requests
     */
    private String defaultDriver;

    /**
     * Region reported to clients
     */
    private String region = "us-east-1";
}
