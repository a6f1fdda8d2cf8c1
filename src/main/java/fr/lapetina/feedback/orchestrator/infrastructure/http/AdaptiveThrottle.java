package fr.lapetina.feedback.orchestrator.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Self-tuning minimum-interval rate limiter for remote calls.
 *
 * Failures stretch the interval multiplicatively up to a ceiling; successes shrink it
 * gradually down to a floor. Quota rejections stretch it harder and additionally open a
 * cooldown window, doubling with each consecutive rejection, during which callers should
 * not call the remote service at all.
 *
 * Thread-safe. Concurrent callers reserve successive slots under the monitor and sleep
 * outside it, so admitted calls stay at least one interval apart.
 */
public final class AdaptiveThrottle {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveThrottle.class);

    public enum Outcome {
        SUCCESS,
        FAILURE,
        QUOTA_EXCEEDED
    }

    /**
     * Blocking pause, replaceable in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        Sleeper THREAD = duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);

        void sleep(Duration duration) throws InterruptedException;
    }

    private final double floorMs;
    private final double ceilingMs;
    private final double failureMultiplier;
    private final double successMultiplier;
    private final double quotaMultiplier;
    private final Duration quotaCooldownInitial;
    private final Duration quotaCooldownMax;
    private final Clock clock;
    private final Sleeper sleeper;

    private double minIntervalMs;
    private Instant lastRequestTime;
    private int consecutiveQuotaErrors;
    private Instant rateLimitedUntil;

    private AdaptiveThrottle(Builder builder) {
        if (builder.floor.isNegative() || builder.ceiling.compareTo(builder.floor) < 0) {
            throw new IllegalArgumentException(
                    "Invalid throttle bounds: floor=" + builder.floor + ", ceiling=" + builder.ceiling);
        }
        this.floorMs = toMillis(builder.floor);
        this.ceilingMs = toMillis(builder.ceiling);
        this.failureMultiplier = builder.failureMultiplier;
        this.successMultiplier = builder.successMultiplier;
        this.quotaMultiplier = builder.quotaMultiplier;
        this.quotaCooldownInitial = builder.quotaCooldownInitial;
        this.quotaCooldownMax = builder.quotaCooldownMax;
        this.clock = builder.clock;
        this.sleeper = builder.sleeper;
        this.minIntervalMs = floorMs;

        log.info("AdaptiveThrottle initialized: floorMs={}, ceilingMs={}", floorMs, ceilingMs);
    }

    /**
     * Blocks until the minimum interval has elapsed since the previously admitted call.
     *
     * @return how long the caller waited
     */
    public Duration waitIfNeeded() {
        Duration delay;
        synchronized (this) {
            Instant now = clock.instant();
            Instant slot = now;
            if (lastRequestTime != null) {
                Instant earliest = lastRequestTime.plusNanos(Math.round(minIntervalMs * 1_000_000));
                if (earliest.isAfter(now)) {
                    slot = earliest;
                }
            }
            lastRequestTime = slot;
            delay = Duration.between(now, slot);
        }

        if (delay.isZero() || delay.isNegative()) {
            return Duration.ZERO;
        }
        log.debug("Throttling remote call: delayMs={}", delay.toMillis());
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while throttling remote call");
        }
        return delay;
    }

    /**
     * Adapts the interval to the outcome of a remote call.
     */
    public synchronized void adjust(Outcome outcome) {
        double previous = minIntervalMs;
        switch (outcome) {
            case SUCCESS -> {
                consecutiveQuotaErrors = 0;
                if (minIntervalMs > floorMs) {
                    minIntervalMs = Math.max(floorMs, minIntervalMs * successMultiplier);
                }
            }
            case FAILURE -> minIntervalMs = Math.min(ceilingMs, minIntervalMs * failureMultiplier);
            case QUOTA_EXCEEDED -> {
                minIntervalMs = Math.min(ceilingMs, minIntervalMs * quotaMultiplier);
                consecutiveQuotaErrors++;
                Duration cooldown = quotaCooldown(consecutiveQuotaErrors);
                rateLimitedUntil = clock.instant().plus(cooldown);
                log.warn("Remote quota exceeded, rate limited: consecutive={}, cooldownMs={}",
                        consecutiveQuotaErrors, cooldown.toMillis());
            }
        }
        if (previous != minIntervalMs) {
            log.debug("Throttle interval adjusted: outcome={}, fromMs={}, toMs={}",
                    outcome, Math.round(previous), Math.round(minIntervalMs));
        }
    }

    private Duration quotaCooldown(int consecutive) {
        int exponent = Math.min(consecutive - 1, 30);
        Duration cooldown = quotaCooldownInitial.multipliedBy(1L << exponent);
        return cooldown.compareTo(quotaCooldownMax) > 0 ? quotaCooldownMax : cooldown;
    }

    /**
     * True while a quota cooldown window is in effect.
     */
    public synchronized boolean isRateLimited() {
        return rateLimitedUntil != null && clock.instant().isBefore(rateLimitedUntil);
    }

    public synchronized Duration getMinInterval() {
        return Duration.ofNanos(Math.round(minIntervalMs * 1_000_000));
    }

    public synchronized int getConsecutiveQuotaErrors() {
        return consecutiveQuotaErrors;
    }

    public Duration getFloor() {
        return Duration.ofNanos(Math.round(floorMs * 1_000_000));
    }

    public Duration getCeiling() {
        return Duration.ofNanos(Math.round(ceilingMs * 1_000_000));
    }

    private static double toMillis(Duration duration) {
        return duration.toNanos() / 1_000_000.0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration floor = Duration.ofMillis(100);
        private Duration ceiling = Duration.ofSeconds(1);
        private double failureMultiplier = 1.5;
        private double successMultiplier = 0.9;
        private double quotaMultiplier = 2.25;
        private Duration quotaCooldownInitial = Duration.ofSeconds(5);
        private Duration quotaCooldownMax = Duration.ofMinutes(5);
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.THREAD;

        public Builder floor(Duration floor) {
            this.floor = floor;
            return this;
        }

        public Builder ceiling(Duration ceiling) {
            this.ceiling = ceiling;
            return this;
        }

        public Builder failureMultiplier(double failureMultiplier) {
            this.failureMultiplier = failureMultiplier;
            return this;
        }

        public Builder successMultiplier(double successMultiplier) {
            this.successMultiplier = successMultiplier;
            return this;
        }

        public Builder quotaMultiplier(double quotaMultiplier) {
            this.quotaMultiplier = quotaMultiplier;
            return this;
        }

        public Builder quotaCooldown(Duration initial, Duration max) {
            this.quotaCooldownInitial = initial;
            this.quotaCooldownMax = max;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public AdaptiveThrottle build() {
            return new AdaptiveThrottle(this);
        }
    }
}
