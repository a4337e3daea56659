package io.github.drompincen.channelhub.runtime.webhook;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs one account's activities one at a time and in arrival order. At most one drain task per lane
 * occupies the shared executor; tasks are expected to handle their own failures.
 */
final class AccountLane {

    private final Executor executor;
    private final Queue<Runnable> queue = new ArrayDeque<>();
    private boolean draining;

    AccountLane(Executor executor) {
        this.executor = executor;
    }

    /**
     * @throws RejectedExecutionException when the executor cannot take a new drain task; the
     *         activity is then not queued
     */
    synchronized void submit(Runnable task) {
        queue.add(task);
        if (draining) return;
        draining = true;
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining = false;
            queue.clear();
            throw e;
        }
    }

    private void drain() {
        while (true) {
            Runnable next;
            synchronized (this) {
                next = queue.poll();
                if (next == null) {
                    draining = false;
                    return;
                }
            }
            next.run();
        }
    }
}
