package treeqa.recorder;

/** Recorder commands bound to keyboard shortcuts. */
public enum HotkeyCommand {

    START_STOP("Ctrl+Shift+R"),
    PAUSE_RESUME("Ctrl+Shift+P"),
    SAVE("Ctrl+Shift+S"),
    CAPTURE_ASSERT("Ctrl+Shift+A");

    private final Hotkey defaultHotkey;

    HotkeyCommand(String defaultHotkey) {
        this.defaultHotkey = Hotkey.parse(defaultHotkey);
    }

    public Hotkey defaultHotkey() {
        return defaultHotkey;
    }
}
