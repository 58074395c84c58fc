package treeqa.recorder;

import java.util.function.Consumer;

/**
 * Abstraction over the UI framework's input routing. Implementations hook the
 * window's pointer, keyboard and text-input events and forward them to the
 * provided callback, on any thread.
 */
public interface InputSource {

    /**
     * Starts delivering events to {@code eventCallback}.
     *
     * @param eventCallback consumer that receives each raw {@link InputEvent}
     */
    void start(Consumer<InputEvent> eventCallback);

    /** Stops delivering events and releases any hooks. */
    void stop();
}
