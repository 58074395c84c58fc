package treeqa.recorder;

/** Lifecycle of an {@link InteractionSession}. {@code OFF} is both initial and terminal. */
public enum RecorderState {
    OFF,
    RECORDING,
    PAUSED
}
