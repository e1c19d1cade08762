package win.ixuni.nimbus.client.config;

import lombok.Builder;
import lombok.Value;
import win.ixuni.nimbus.client.limiter.RateLimiter;

import java.time.Duration;

/**
 * 客户端配置
 * <p>
 * Immutable; create with {@link #builder()}. Unset values fall back to the defaults below.
 */
@Value
@Builder(toBuilder = true)
public class ClientConfiguration {

    @Builder.Default
    Scheme scheme = Scheme.HTTP;

    /**
     * host[:port] of the storage service
     */
    @Builder.Default
    String endpoint = "localhost:9000";

    @Builder.Default
    Duration connectTimeout = Duration.ofSeconds(30);

    /**
     * Maximum time without response data before a request fails
     */
    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(30);

    String proxyHost;

    Integer proxyPort;

    /**
     * Throttles response bodies, null for unlimited
     */
    RateLimiter readRateLimiter;

    /**
     * Throttles request bodies, null for unlimited
     */
    RateLimiter writeRateLimiter;

    @Builder.Default
    int maxRetries = 3;

    /**
     * First backoff delay; later delays grow exponentially
     */
    @Builder.Default
    Duration retryBaseDelay = Duration.ofMillis(100);

    @Builder.Default
    int maxConnections = 25;

    @Builder.Default
    String userAgent = "nimbus-client/0.1";

    /**
     * @return scheme://endpoint without a trailing slash
     */
    public String baseUrl() {
        String host = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        return scheme.getValue() + "://" + host;
    }

    public boolean hasProxy() {
        return proxyHost != null && !proxyHost.isBlank() && proxyPort != null;
    }
}
