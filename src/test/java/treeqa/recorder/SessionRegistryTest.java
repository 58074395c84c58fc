package treeqa.recorder;

import org.testng.annotations.Test;
import treeqa.TestTrees;
import treeqa.model.TreeAccess;

import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

public class SessionRegistryTest {

    private final PumpedOwnerContext owner = new PumpedOwnerContext();

    private Supplier<InteractionSession> factory(AtomicInteger created) {
        return () -> {
            created.incrementAndGet();
            return new InteractionSession(TreeAccess.of(TestTrees.login().window),
                    RecorderConfig.of(new Properties()), owner);
        };
    }

    @Test(description = "Attaching twice to the same owner returns the same session")
    public void attachIsIdempotent() {
        SessionRegistry registry = new SessionRegistry();
        AtomicInteger created = new AtomicInteger();
        Object window = new Object();

        InteractionSession first = registry.attach(window, factory(created));
        InteractionSession second = registry.attach(window, factory(created));

        assertThat(second).isSameAs(first);
        assertThat(created).hasValue(1);
        assertThat(registry.get(window)).containsSame(first);
        registry.closeAll();
    }

    @Test(description = "Closing the owner disposes and forgets its session")
    public void ownerClosedDisposes() {
        SessionRegistry registry = new SessionRegistry();
        Object window = new Object();
        InteractionSession session = registry.attach(window, factory(new AtomicInteger()));
        session.start();

        assertThat(registry.ownerClosed(window)).isTrue();
        assertThat(session.state()).isEqualTo(RecorderState.OFF);
        assertThat(registry.get(window)).isEmpty();
        assertThat(registry.ownerClosed(window)).isFalse();
    }

    @Test
    public void closeAll() {
        SessionRegistry registry = new SessionRegistry();
        AtomicInteger created = new AtomicInteger();
        registry.attach("main", factory(created));
        registry.attach("dialog", factory(created));
        assertThat(registry.size()).isEqualTo(2);

        registry.closeAll();
        assertThat(registry.size()).isZero();
    }
}
