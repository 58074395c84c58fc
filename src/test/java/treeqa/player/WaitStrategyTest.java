package treeqa.player;

import org.testng.annotations.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class WaitStrategyTest {

    @Test(description = "Returns as soon as the probe yields a value")
    public void untilReturnsFirstValue() {
        AtomicInteger calls = new AtomicInteger();
        String value = new WaitStrategy(1000, 5).until("third call",
                () -> calls.incrementAndGet() >= 3 ? Optional.of("done") : Optional.empty());

        assertThat(value).isEqualTo("done");
        assertThat(calls).hasValue(3);
    }

    @Test
    public void timesOut() {
        WaitStrategy wait = new WaitStrategy(50, 10);
        assertThatThrownBy(() -> wait.untilTrue("nothing", () -> false))
                .isInstanceOf(TreeQAException.class)
                .hasMessage("Timed out after 50ms waiting for nothing");
    }

    @Test(description = "An interrupted wait fails and keeps the interrupt flag")
    public void interruptRestoresFlag() {
        WaitStrategy wait = new WaitStrategy(1000, 10);
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> wait.untilTrue("never", () -> false))
                    .hasMessage("Interrupted while waiting");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    public void rejectsNonPositiveSettings() {
        assertThatThrownBy(() -> new WaitStrategy(0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WaitStrategy(10, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
