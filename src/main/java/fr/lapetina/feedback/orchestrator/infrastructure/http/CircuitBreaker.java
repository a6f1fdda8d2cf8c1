package fr.lapetina.feedback.orchestrator.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Circuit breaker protecting the remote analysis service.
 *
 * States:
 * - CLOSED: Normal operation, remote calls permitted
 * - OPEN: Failures reached threshold, remote calls bypassed until the reset deadline
 *
 * There is no half-open state. Once the deadline passes, the next check closes the
 * circuit and zeroes the failure count; the next remote call is the trial, and the
 * circuit reopens as soon as the threshold is breached again.
 *
 * Thread-safe. All transitions happen under the instance monitor so that a check
 * immediately following a failure observes it.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Clock clock;

    private State state = State.CLOSED;
    private int consecutiveFailures;
    private Instant resetDeadline;
    private Instant lastFailureTime;

    public CircuitBreaker(String name, int failureThreshold, Duration resetTimeout, Clock clock) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("Failure threshold must be positive: " + failureThreshold);
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.clock = clock;
    }

    public CircuitBreaker(String name) {
        this(name, 3, Duration.ofMinutes(2), Clock.systemUTC());
    }

    /**
     * Checks whether remote calls are currently bypassed.
     * Closes the circuit when the reset deadline has been reached.
     *
     * @return true if the circuit is open
     */
    public synchronized boolean isOpen() {
        if (state == State.CLOSED) {
            return false;
        }
        Instant now = clock.instant();
        if (!now.isBefore(resetDeadline)) {
            state = State.CLOSED;
            consecutiveFailures = 0;
            resetDeadline = null;
            log.info("Circuit breaker reset deadline reached, CLOSED: name={}", name);
            return false;
        }
        log.debug("Circuit breaker open: name={}, remainingMs={}",
                name, Duration.between(now, resetDeadline).toMillis());
        return true;
    }

    /**
     * Records a successful remote call.
     */
    public synchronized void recordSuccess() {
        consecutiveFailures = 0;
    }

    /**
     * Records a failed remote call.
     */
    public void recordFailure() {
        recordFailure(1);
    }

    /**
     * Records a failure counting {@code weight} times toward the threshold.
     */
    public synchronized void recordFailure(int weight) {
        Instant now = clock.instant();
        lastFailureTime = now;
        consecutiveFailures += Math.max(1, weight);

        if (consecutiveFailures >= failureThreshold) {
            boolean wasClosed = state == State.CLOSED;
            state = State.OPEN;
            resetDeadline = now.plus(resetTimeout);
            if (wasClosed) {
                log.warn("Circuit breaker OPENED: name={}, failures={}, resetTimeoutMs={}",
                        name, consecutiveFailures, resetTimeout.toMillis());
            }
        } else {
            log.debug("Circuit breaker failure recorded: name={}, failures={}/{}",
                    name, consecutiveFailures, failureThreshold);
        }
    }

    /**
     * Forces the circuit to a specific state. For testing/admin use.
     */
    public synchronized void forceState(State newState) {
        State old = state;
        state = newState;
        if (newState == State.CLOSED) {
            consecutiveFailures = 0;
            resetDeadline = null;
        } else {
            resetDeadline = clock.instant().plus(resetTimeout);
        }
        log.info("Circuit breaker forced from {} to {}: name={}", old, newState, name);
    }

    /**
     * Current state without performing the deadline check.
     */
    public synchronized State getState() {
        return state;
    }

    /**
     * Time left before the circuit closes, zero when closed.
     */
    public synchronized Duration remainingOpenTime() {
        if (state == State.CLOSED || resetDeadline == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), resetDeadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public synchronized int getFailureCount() {
        return consecutiveFailures;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public String getName() {
        return name;
    }

    @Override
    public synchronized String toString() {
        return "CircuitBreaker{" +
                "name='" + name + '\'' +
                ", state=" + state +
                ", failures=" + consecutiveFailures +
                '}';
    }
}
