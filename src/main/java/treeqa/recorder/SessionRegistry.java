package treeqa.recorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Maps an opaque owner handle (typically a window) to its recording session.
 * Attaching is idempotent; closing the owner disposes its session.
 */
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<Object, InteractionSession> sessions = new ConcurrentHashMap<>();

    /**
     * Returns the session for {@code owner}, creating it with {@code factory}
     * on first attach. Later calls return the same session and do not invoke
     * the factory.
     */
    public InteractionSession attach(Object owner, Supplier<InteractionSession> factory) {
        Objects.requireNonNull(owner, "owner");
        return sessions.computeIfAbsent(owner, o -> {
            log.info("Attaching recorder session to {}", o);
            return factory.get();
        });
    }

    public Optional<InteractionSession> get(Object owner) {
        return Optional.ofNullable(sessions.get(owner));
    }

    /**
     * Lifecycle hook for owner teardown: removes and closes the session.
     *
     * @return {@code true} if a session was attached
     */
    public boolean ownerClosed(Object owner) {
        InteractionSession session = sessions.remove(owner);
        if (session == null) return false;
        log.info("Owner {} closed, disposing its recorder session", owner);
        session.close();
        return true;
    }

    public int size() {
        return sessions.size();
    }

    /** Closes every registered session. */
    public void closeAll() {
        for (Object owner : sessions.keySet()) {
            ownerClosed(owner);
        }
    }
}
