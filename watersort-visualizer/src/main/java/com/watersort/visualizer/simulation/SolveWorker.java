package com.watersort.visualizer.simulation;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one solve at a time on a daemon thread. A search only stops at its budget, so cancelling the
 * task that wraps it does not free the worker; it stays busy until the job actually returns.
 */
public final class SolveWorker {

    private final String threadName;
    private final Executor callbackExecutor;
    private final AtomicBoolean busy = new AtomicBoolean(false);

    /**
     * @param threadName       name of the worker threads
     * @param callbackExecutor runs the idle callbacks, {@code Platform::runLater} in the application
     */
    public SolveWorker(String threadName, Executor callbackExecutor) {
        this.threadName = Objects.requireNonNull(threadName, "threadName");
        this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "callbackExecutor");
    }

    /**
     * Starts {@code job} unless a previous job is still running. {@code onIdle} is handed to the
     * callback executor once the job has returned, normally or not.
     *
     * @return {@code false} if the worker was busy and nothing was started
     */
    public boolean start(Runnable job, Runnable onIdle) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(onIdle, "onIdle");
        if (!busy.compareAndSet(false, true)) {
            return false;
        }
        Thread thread = new Thread(() -> {
            try {
                job.run();
            } finally {
                busy.set(false);
                callbackExecutor.execute(onIdle);
            }
        }, threadName);
        thread.setDaemon(true);
        try {
            thread.start();
        } catch (RuntimeException | Error ex) {
            busy.set(false);
            throw ex;
        }
        return true;
    }

    public boolean isBusy() {
        return busy.get();
    }
}
