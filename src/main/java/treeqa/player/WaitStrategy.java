package treeqa.player;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Centralises all polling waits of the player so timeouts are deterministic
 * and logged uniformly. Conditions are evaluated on the calling thread.
 */
public class WaitStrategy {

    private static final Logger log = LoggerFactory.getLogger(WaitStrategy.class);

    private final long timeoutMs;
    private final long pollMs;

    /**
     * @param timeoutMs maximum time to wait for any condition
     * @param pollMs    delay between two evaluations
     */
    public WaitStrategy(long timeoutMs, long pollMs) {
        if (timeoutMs <= 0 || pollMs <= 0) {
            throw new IllegalArgumentException("timeout and poll interval must be positive");
        }
        this.timeoutMs = timeoutMs;
        this.pollMs = pollMs;
    }

    public WaitStrategy(PlayerConfig config) {
        this(config.getWaitTimeoutMs(), config.getWaitPollMs());
    }

    /**
     * Polls {@code probe} until it yields a value.
     *
     * @param description what is being waited for, used in logs and the failure message
     * @return the first value produced
     * @throws TreeQAException if nothing was produced within the timeout
     */
    public <T> T until(String description, Supplier<Optional<T>> probe) {
        log.debug("Waiting up to {}ms for {}", timeoutMs, description);
        long deadline = System.nanoTime() + timeoutMs * 1_000_000L;
        while (true) {
            Optional<T> value = probe.get();
            if (value.isPresent()) return value.get();
            if (System.nanoTime() - deadline >= 0) {
                throw new TreeQAException("Timed out after " + timeoutMs + "ms waiting for " + description);
            }
            sleep();
        }
    }

    /** Polls {@code condition} until it holds. */
    public void untilTrue(String description, BooleanSupplier condition) {
        until(description, () -> condition.getAsBoolean() ? Optional.of(Boolean.TRUE) : Optional.empty());
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    private void sleep() {
        try {
            Thread.sleep(pollMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TreeQAException("Interrupted while waiting", e);
        }
    }
}
