package treeqa.recorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treeqa.player.TreeQAException;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * {@link OwnerContext} backed by a dedicated single-thread executor. Suits
 * headless use where no UI event loop exists.
 */
public class ExecutorOwnerContext implements OwnerContext, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutorOwnerContext.class);

    private final ExecutorService executor;
    private volatile Thread ownerThread;

    public ExecutorOwnerContext(String threadName) {
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            ownerThread = t;
            return t;
        });
    }

    @Override
    public boolean isOwnerThread() {
        return Thread.currentThread() == ownerThread;
    }

    @Override
    public void post(Runnable task) {
        executor.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Owner task failed", e);
            }
        });
    }

    @Override
    public <T> T invoke(Callable<T> task) {
        if (isOwnerThread()) {
            return call(task);
        }
        try {
            return executor.submit(() -> call(task)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TreeQAException("Interrupted while waiting for the owner thread", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new TreeQAException("Owner task failed", e.getCause());
        }
    }

    /** Stops the owner thread after queued tasks have run. */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Owner thread did not drain within 5s, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static <T> T call(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new TreeQAException("Owner task failed", e);
        }
    }
}
