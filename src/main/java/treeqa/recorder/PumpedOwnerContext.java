package treeqa.recorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treeqa.player.TreeQAException;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;

/**
 * {@link OwnerContext} whose tasks are drained by the thread that created it,
 * the way a UI event loop pumps its dispatcher queue. Posted tasks run only
 * when the owner calls {@link #runPending()}.
 */
public class PumpedOwnerContext implements OwnerContext {

    private static final Logger log = LoggerFactory.getLogger(PumpedOwnerContext.class);

    private final Thread ownerThread = Thread.currentThread();
    private final ConcurrentLinkedQueue<Runnable> queue = new ConcurrentLinkedQueue<>();

    @Override
    public boolean isOwnerThread() {
        return Thread.currentThread() == ownerThread;
    }

    @Override
    public void post(Runnable task) {
        queue.add(task);
    }

    /**
     * Blocks until the owner pumps the task when called from another thread;
     * the owner must keep calling {@link #runPending()} meanwhile.
     */
    @Override
    public <T> T invoke(Callable<T> task) {
        if (isOwnerThread()) {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new TreeQAException("Owner task failed", e);
            }
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        queue.add(() -> {
            try {
                result.complete(task.call());
            } catch (Exception e) {
                result.completeExceptionally(e);
            }
        });
        try {
            return result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TreeQAException("Interrupted while waiting for the owner thread", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new TreeQAException("Owner task failed", e.getCause());
        }
    }

    /**
     * Runs every queued task, including tasks queued while draining.
     *
     * @return the number of tasks run
     * @throws IllegalStateException if called off the owner thread
     */
    public int runPending() {
        if (!isOwnerThread()) {
            throw new IllegalStateException("runPending() must be called on the owner thread");
        }
        int count = 0;
        Runnable task;
        while ((task = queue.poll()) != null) {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Owner task failed", e);
            }
            count++;
        }
        return count;
    }

    public int pendingCount() {
        return queue.size();
    }
}
