package treeqa.recorder;

import org.testng.annotations.Test;
import treeqa.recorder.InputEvent.Modifier;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class HotkeyTest {

    @Test
    public void parse() {
        Hotkey h = Hotkey.parse("Ctrl+Shift+r");

        assertThat(h.modifiers()).containsExactlyInAnyOrder(Modifier.CTRL, Modifier.SHIFT);
        assertThat(h.key()).isEqualTo("R");
        assertThat(h).hasToString("Ctrl+Shift+R");
    }

    @Test(description = "Modifier aliases map onto the same modifiers")
    public void aliases() {
        assertThat(Hotkey.parse("control+cmd+F5")).isEqualTo(new Hotkey(Set.of(Modifier.CTRL, Modifier.META), "f5"));
        assertThat(Hotkey.parse("Esc").modifiers()).isEmpty();
    }

    @Test
    public void rejectsMalformed() {
        assertThatThrownBy(() -> Hotkey.parse("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Hotkey.parse("Ctrl+ ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Hotkey.parse("Hyper+R")).hasMessageContaining("Unknown modifier");
    }

    @Test(description = "Matching requires a key-down with exactly the same modifiers")
    public void matches() {
        Hotkey h = Hotkey.parse("Ctrl+Shift+R");

        assertThat(h.matches(InputEvent.keyDown(null, "r", Modifier.SHIFT, Modifier.CTRL))).isTrue();
        assertThat(h.matches(InputEvent.keyDown(null, "R", Modifier.CTRL))).isFalse();
        assertThat(h.matches(InputEvent.keyDown(null, "R", Modifier.CTRL, Modifier.SHIFT, Modifier.ALT))).isFalse();
        assertThat(h.matches(InputEvent.keyDown(null, "S", Modifier.CTRL, Modifier.SHIFT))).isFalse();
        assertThat(h.matches(InputEvent.text(null, "R"))).isFalse();
    }

    @Test
    public void specialKeyNames() {
        assertThat(SpecialKeys.canonical("return")).isEqualTo("Enter");
        assertThat(SpecialKeys.canonical("ArrowLeft")).isEqualTo("Left");
        assertThat(SpecialKeys.canonical("f12")).isEqualTo("F12");
        assertThat(SpecialKeys.canonical("a")).isNull();
        assertThat(SpecialKeys.canonical(null)).isNull();
    }

    @Test(description = "Chords list held modifiers in Ctrl, Shift, Alt, Meta order")
    public void specialKeyChords() {
        assertThat(SpecialKeys.chord(Set.of(), "Enter")).isEqualTo("Enter");
        assertThat(SpecialKeys.chord(Set.of(Modifier.SHIFT, Modifier.CTRL), "Tab")).isEqualTo("Ctrl+Shift+Tab");
    }
}
