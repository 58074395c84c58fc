package treeqa.recorder;

import java.util.concurrent.Callable;

/**
 * The single logical thread that owns a UI tree (the UI dispatcher). Tree
 * reads, locator resolution and step mutation all happen here.
 */
public interface OwnerContext {

    /** True when the calling thread is the owner thread. */
    boolean isOwnerThread();

    /** Queues {@code task} to run on the owner thread and returns immediately. */
    void post(Runnable task);

    /**
     * Runs {@code task} on the owner thread and waits for its result. Runs it
     * inline when already on the owner thread.
     *
     * @throws treeqa.player.TreeQAException wrapping a checked exception thrown by the task
     */
    <T> T invoke(Callable<T> task);
}
