package win.ixuni.nimbus.client.limiter;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class DefaultRateLimiterTest {

    private final AtomicLong clock = new AtomicLong(0);

    @Test
    void burstWithinOneSecondIsFree() {
        DefaultRateLimiter limiter = new DefaultRateLimiter(1000, clock::get);

        assertEquals(Duration.ZERO, limiter.applyCost(600));
        assertEquals(Duration.ZERO, limiter.applyCost(400));
    }

    @Test
    void debtIsReturnedAsDelay() {
        DefaultRateLimiter limiter = new DefaultRateLimiter(1000, clock::get);

        limiter.applyCost(1000);
        Duration delay = limiter.applyCost(500);

        assertEquals(500, delay.toMillis());
    }

    @Test
    void tokensRefillOverTime() {
        DefaultRateLimiter limiter = new DefaultRateLimiter(1000, clock::get);
        limiter.applyCost(1000);

        clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(250));

        assertEquals(Duration.ZERO, limiter.applyCost(250));
        assertEquals(100, limiter.applyCost(100).toMillis());
    }

    @Test
    void refillIsCappedAtOneSecond() {
        DefaultRateLimiter limiter = new DefaultRateLimiter(1000, clock::get);

        clock.addAndGet(TimeUnit.SECONDS.toNanos(10));

        assertEquals(Duration.ZERO, limiter.applyCost(1000));
        assertTrue(limiter.applyCost(1).compareTo(Duration.ZERO) > 0);
    }

    @Test
    void zeroCostNeverWaits() {
        DefaultRateLimiter limiter = new DefaultRateLimiter(10, clock::get);
        limiter.applyCost(100);

        assertEquals(Duration.ZERO, limiter.applyCost(0));
    }

    @Test
    void rateCanBeChanged() {
        DefaultRateLimiter limiter = new DefaultRateLimiter(1000, clock::get);
        limiter.setRate(100);

        assertEquals(100, limiter.getRate());
        assertEquals(Duration.ZERO, limiter.applyCost(100));
        assertEquals(1000, limiter.applyCost(100).toMillis());
    }

    @Test
    void rejectsNonPositiveRate() {
        assertThrows(IllegalArgumentException.class, () -> new DefaultRateLimiter(0));
        assertThrows(IllegalArgumentException.class, () -> new DefaultRateLimiter(1).setRate(-1));
    }
}
