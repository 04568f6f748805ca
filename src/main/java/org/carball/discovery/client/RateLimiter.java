package org.carball.discovery.client;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket refilled lazily from elapsed time. Grants are also capped at {@code rate} per
 * {@code period} over any sliding window, so a full bucket cannot double up with its own refill.
 */
@Slf4j
public class RateLimiter {

    private final int rate;
    private final int capacity;
    private final Duration period;
    private final double tokensPerMilli;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private double tokens;
    private long lastRefillMillis;
    private final Deque<Long> grants = new ArrayDeque<>();

    public RateLimiter(int rate, int burst, Duration period, Clock clock, Sleeper sleeper) {
        if (rate < 1 || burst < 1) {
            throw new IllegalArgumentException("Rate and burst must be positive: rate=" + rate + ", burst=" + burst);
        }
        this.rate = rate;
        this.capacity = Math.min(burst, rate);
        this.period = period;
        this.tokensPerMilli = (double) rate / period.toMillis();
        this.clock = clock;
        this.sleeper = sleeper;
        this.tokens = capacity;
        this.lastRefillMillis = clock.millis();
    }

    public static RateLimiter perMinute(int rate, int burst) {
        return new RateLimiter(rate, burst, Duration.ofMinutes(1), Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public void acquire() throws InterruptedException {
        acquire(1);
    }

    /**
     * Blocks until {@code permits} tokens are available. Interruption aborts the wait.
     */
    public void acquire(int permits) throws InterruptedException {
        checkPermits(permits);
        while (true) {
            long waitMillis = tryReserve(permits);
            if (waitMillis == 0) {
                return;
            }
            log.trace("Rate limit reached, waiting {}ms for {} token(s)", waitMillis, permits);
            sleeper.sleep(Duration.ofMillis(waitMillis));
        }
    }

    /**
     * Waits at most {@code timeout} for the tokens; returns false if they could not be granted in time.
     */
    public boolean tryAcquire(int permits, Duration timeout) throws InterruptedException {
        checkPermits(permits);
        long deadline = clock.millis() + timeout.toMillis();
        while (true) {
            long waitMillis = tryReserve(permits);
            if (waitMillis == 0) {
                return true;
            }
            long remaining = deadline - clock.millis();
            if (remaining <= 0) {
                return false;
            }
            sleeper.sleep(Duration.ofMillis(Math.min(waitMillis, remaining)));
        }
    }

    public double availableTokens() {
        lock.lock();
        try {
            refill(clock.millis());
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    public int getRate() {
        return rate;
    }

    public Duration getPeriod() {
        return period;
    }

    /**
     * Takes the tokens and returns 0, or returns how long to wait before trying again.
     */
    private long tryReserve(int permits) {
        lock.lock();
        try {
            long now = clock.millis();
            refill(now);
            long periodMillis = period.toMillis();
            while (!grants.isEmpty() && grants.peekFirst() + periodMillis <= now) {
                grants.pollFirst();
            }

            long tokenWait = tokens >= permits ? 0 : (long) Math.ceil((permits - tokens) / tokensPerMilli);
            long windowWait = 0;
            int overflow = grants.size() + permits - rate;
            if (overflow > 0) {
                // The oldest grants have to age out of the window first
                long oldestBlocking = grants.stream().skip(overflow - 1).findFirst().orElse(now);
                windowWait = oldestBlocking + periodMillis - now;
            }

            long wait = Math.max(tokenWait, windowWait);
            if (wait > 0) {
                return Math.max(1, wait);
            }
            tokens -= permits;
            for (int i = 0; i < permits; i++) {
                grants.addLast(now);
            }
            return 0;
        } finally {
            lock.unlock();
        }
    }

    private void refill(long now) {
        long elapsed = now - lastRefillMillis;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * tokensPerMilli);
            lastRefillMillis = now;
        }
    }

    private void checkPermits(int permits) {
        if (permits < 1 || permits > capacity) {
            throw new IllegalArgumentException("Requested " + permits + " tokens, bucket capacity is " + capacity);
        }
    }
}
