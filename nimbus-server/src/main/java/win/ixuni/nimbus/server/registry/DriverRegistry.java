package win.ixuni.nimbus.server.registry;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.config.DriverConfig;
import win.ixuni.nimbus.core.config.NimbusProperties;
import win.ixuni.nimbus.core.driver.DriverFactory;
import win.ixuni.nimbus.core.driver.StorageDriver;
import win.ixuni.nimbus.core.exception.DriverNotFoundException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 驱动注册表
 * <p>
 * Builds every enabled {@code nimbus.drivers} entry at startup and fails the boot on a
 * misconfiguration (unknown type, duplicate name, unresolvable default driver).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DriverRegistry {

    private final NimbusProperties properties;
    private final List<DriverFactory> driverFactories;

    /**
     * name -> driver, in configuration order
     */
    private final Map<String, StorageDriver> drivers = new LinkedHashMap<>();

    private volatile StorageDriver defaultDriver;

    @PostConstruct
    public void initialize() {
        Map<String, DriverFactory> factoriesByType = driverFactories.stream()
                .collect(Collectors.toMap(DriverFactory::getDriverType, Function.identity(), (first, second) -> {
                    throw new IllegalStateException("Two driver factories for type '" + first.getDriverType() + "'");
                }));
        factoriesByType.values().forEach(factory ->
                log.info("Driver factory available: {} - {}", factory.getDriverType(), factory.getDescription()));

        for (DriverConfig config : properties.getDrivers()) {
            if (!config.isEnabled()) {
                log.info("Driver '{}' is disabled, skipping", config.getName());
                continue;
            }
            if (drivers.containsKey(config.getName())) {
                throw new IllegalStateException("Driver name '" + config.getName() + "' is configured twice");
            }
            drivers.put(config.getName(), create(config, factoriesByType));
        }

        defaultDriver = resolveDefault();
        log.info("Driver registry ready: {} (default '{}')", drivers.keySet(), defaultDriver.getDriverName());
    }

    private StorageDriver create(DriverConfig config, Map<String, DriverFactory> factoriesByType) {
        DriverFactory factory = factoriesByType.get(config.getType());
        if (factory == null) {
            throw new IllegalStateException("Unknown driver type '" + config.getType()
                    + "' for driver '" + config.getName() + "', known types: " + factoriesByType.keySet());
        }
        StorageDriver driver = factory.createDriver(config);
        driver.initialize().block();
        log.info("Created driver instance: {} (type: {})", config.getName(), config.getType());
        return driver;
    }

    private StorageDriver resolveDefault() {
        String name = properties.getDefaultDriver();
        if ((name == null || name.isEmpty()) && drivers.size() == 1) {
            return drivers.values().iterator().next();
        }
        return getDriver(name);
    }

    @PreDestroy
    public void shutdown() {
        Flux.fromIterable(drivers.values())
                .concatMap(driver -> driver.shutdown()
                        .onErrorResume(e -> {
                            log.error("Error shutting down driver '{}': {}", driver.getDriverName(), e.getMessage());
                            return Mono.empty();
                        }))
                .blockLast();
        drivers.clear();
    }

    /**
     * @throws DriverNotFoundException when no driver has that name
     */
    public StorageDriver getDriver(String name) {
        StorageDriver driver = name == null ? null : drivers.get(name);
        if (driver == null) {
            throw new DriverNotFoundException(name, drivers.keySet());
        }
        return driver;
    }

    /**
     * The configured default, or the only driver when just one exists
     */
    public StorageDriver getDefaultDriver() {
        return defaultDriver;
    }
}
