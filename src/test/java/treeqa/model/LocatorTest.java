package treeqa.model;

import org.testng.annotations.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LocatorTest {

    @Test(description = "A stable-id locator carrying a diagnostic is rejected")
    public void stableIdRejectsDiagnostic() {
        assertThatThrownBy(() -> new Locator("ok", Locator.Kind.STABLE_ID, "fallback"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not carry a diagnostic");
    }

    @Test(description = "Factories attach the documented diagnostics")
    public void factoryDiagnostics() {
        assertThat(Locator.stableId("x").diagnostic()).isNull();
        assertThat(Locator.displayName("Cancel").diagnostic()).isEqualTo("fallback: display name");
        assertThat(Locator.structuralPath("Panel[0]").diagnostic())
                .isEqualTo("fallback: structural path — high risk of breakage");
    }

    @Test(description = "Quality is derived from the kind only")
    public void qualityFromKind() {
        assertThat(Locator.stableId("x").quality()).isEqualTo(LocatorQuality.HIGH);
        assertThat(Locator.displayName("x").quality()).isEqualTo(LocatorQuality.MEDIUM);
        assertThat(Locator.structuralPath("A[0]").quality()).isEqualTo(LocatorQuality.LOW);
        assertThat(Locator.unresolved("1,2", "error").quality()).isEqualTo(LocatorQuality.LOW);
    }

    @Test(description = "The coordinate sentinel is the only non-durable kind")
    public void sentinelIsNotDurable() {
        assertThat(Locator.unresolved("Button_NoId", "error").isDurable()).isFalse();
        assertThat(Locator.structuralPath("A[0]").isDurable()).isTrue();
    }

    @Test
    public void stepQualityFollowsLocator() {
        Step step = new Step(StepKind.CLICK, Locator.displayName("Cancel"), null, null, Instant.EPOCH);
        assertThat(step.quality()).isEqualTo(LocatorQuality.MEDIUM);
    }
}
