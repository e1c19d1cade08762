package win.ixuni.nimbus.client.limiter;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * Token bucket rate limiter measured in bytes per second
 * <p>
 * The bucket holds at most one second of tokens. A cost larger than the available tokens
 * puts the bucket into debt and the debt is returned as the wait time, so callers are never rejected.
 */
@Slf4j
public class DefaultRateLimiter implements RateLimiter {

    private final LongSupplier nanoClock;
    private final AtomicReference<BucketSnapshot> snapshot;

    public DefaultRateLimiter(long bytesPerSecond) {
        this(bytesPerSecond, System::nanoTime);
    }

    DefaultRateLimiter(long bytesPerSecond, LongSupplier nanoClock) {
        if (bytesPerSecond <= 0) {
            throw new IllegalArgumentException("Rate must be positive: " + bytesPerSecond);
        }
        this.nanoClock = nanoClock;
        this.snapshot = new AtomicReference<>(new BucketSnapshot(bytesPerSecond, bytesPerSecond, nanoClock.getAsLong()));
    }

    @Override
    public Duration applyCost(long cost) {
        if (cost <= 0) {
            return Duration.ZERO;
        }
        while (true) {
            BucketSnapshot current = snapshot.get();
            BucketSnapshot refilled = refill(current);
            BucketSnapshot consumed = new BucketSnapshot(refilled.tokens - cost, refilled.rate, refilled.lastUpdate);

            if (snapshot.compareAndSet(current, consumed)) {
                if (consumed.tokens >= 0) {
                    return Duration.ZERO;
                }
                long waitNanos = (long) (-consumed.tokens * TimeUnit.SECONDS.toNanos(1) / consumed.rate);
                log.trace("Rate limit reached, delaying {} bytes by {} ms", cost, TimeUnit.NANOSECONDS.toMillis(waitNanos));
                return Duration.ofNanos(waitNanos);
            }
            // CAS failed, retry
        }
    }

    @Override
    public long getRate() {
        return snapshot.get().rate;
    }

    @Override
    public void setRate(long bytesPerSecond) {
        if (bytesPerSecond <= 0) {
            throw new IllegalArgumentException("Rate must be positive: " + bytesPerSecond);
        }
        while (true) {
            BucketSnapshot current = snapshot.get();
            BucketSnapshot refilled = refill(current);
            BucketSnapshot updated = new BucketSnapshot(Math.min(refilled.tokens, bytesPerSecond), bytesPerSecond, refilled.lastUpdate);
            if (snapshot.compareAndSet(current, updated)) {
                return;
            }
        }
    }

    private BucketSnapshot refill(BucketSnapshot current) {
        long now = nanoClock.getAsLong();
        long elapsed = Math.max(0, now - current.lastUpdate);
        double tokensToAdd = (double) elapsed * current.rate / TimeUnit.SECONDS.toNanos(1);
        double tokens = Math.min(current.rate, current.tokens + tokensToAdd);
        return new BucketSnapshot(tokens, current.rate, now);
    }

    private record BucketSnapshot(double tokens, long rate, long lastUpdate) {
    }
}
