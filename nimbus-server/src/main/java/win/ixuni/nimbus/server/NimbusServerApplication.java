package win.ixuni.nimbus.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import win.ixuni.nimbus.core.config.NimbusProperties;

/**
 * Nimbus 服务器启动类
 * <p>
 * Scans the whole {@code win.ixuni.nimbus} package so driver factories on the classpath register themselves.
 */
@SpringBootApplication(scanBasePackages = "win.ixuni.nimbus")
@EnableConfigurationProperties(NimbusProperties.class)
public class NimbusServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(NimbusServerApplication.class, args);
    }
}
