package win.ixuni.nimbus.client.limiter;

import java.time.Duration;

/**
 * Bandwidth limiter shared by the requests of a client
 */
public interface RateLimiter {

    /**
     * Account for bytes about to be sent or read
     *
     * @param cost number of bytes
     * @return how long the caller should wait before moving those bytes, {@link Duration#ZERO} when no wait is needed
     */
    Duration applyCost(long cost);

    /**
     * @return current limit in bytes per second
     */
    long getRate();

    void setRate(long bytesPerSecond);
}
