package dev.nuclr.plugin.core.sprite.renderer;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Message queue for a thread that owns a {@link SpriteRenderer} but has no
 * event loop of its own. Any thread may {@link #execute} a task; only the
 * owner thread runs them, from {@link #processEvents()} or
 * {@link #processEventsUntil}.
 *
 * <p>Swing hosts use {@code SwingUtilities::invokeLater} instead.
 */
@Slf4j
public final class OwnerThreadQueue implements Executor {

    private final BlockingQueue<Runnable> tasks = new LinkedBlockingQueue<>();
    private final Thread owner;

    /** Creates a queue owned by the calling thread. */
    public OwnerThreadQueue() {
        this.owner = Thread.currentThread();
    }

    @Override
    public void execute(Runnable task) {
        tasks.add(task);
    }

    public boolean isOwnerThread() {
        return Thread.currentThread() == owner;
    }

    public int pendingCount() {
        return tasks.size();
    }

    /**
     * Run every task queued so far.
     *
     * @return the number of tasks run
     */
    public int processEvents() {
        checkOwner();
        int count = 0;
        Runnable task;
        while ((task = tasks.poll()) != null) {
            runTask(task);
            count++;
        }
        return count;
    }

    /**
     * Run tasks as they arrive until {@code condition} holds or the timeout
     * elapses.
     *
     * @return whether the condition was met
     */
    public boolean processEventsUntil(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        checkOwner();
        long deadline = System.nanoTime() + timeout.toNanos();
        processEvents();
        while (!condition.getAsBoolean()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) return false;
            Runnable task = tasks.poll(remaining, TimeUnit.NANOSECONDS);
            if (task != null) {
                runTask(task);
                processEvents();
            }
        }
        return true;
    }

    private void runTask(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Owner thread task failed", e);
        }
    }

    private void checkOwner() {
        if (!isOwnerThread()) {
            throw new IllegalStateException("Events must be processed on " + owner.getName());
        }
    }
}
