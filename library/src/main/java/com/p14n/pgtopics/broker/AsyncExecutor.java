package com.p14n.pgtopics.broker;

import java.util.List;
import java.util.concurrent.*;

/**
 * Interface for asynchronous task execution.
 */
public interface AsyncExecutor extends AutoCloseable {

    /**
     * Schedules a task for repeated fixed-rate execution.
     *
     * @param command      The task to execute
     * @param initialDelay The time to delay first execution
     * @param period       The period between successive executions
     * @param unit         The time unit of the initialDelay and period parameters
     * @return A ScheduledFuture representing pending completion of the task
     */
    ScheduledFuture<?> scheduleAtFixedRate(Runnable command,
            long initialDelay,
            long period,
            TimeUnit unit);

    /**
     * Schedules a one-shot task. Self-rescheduling loops with a varying delay
     * are built on this.
     *
     * @param command The task to execute
     * @param delay   The time to delay execution
     * @param unit    The time unit of the delay
     * @return A ScheduledFuture representing pending completion of the task
     */
    ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit);

    /**
     * Submits a task to the worker pool.
     *
     * @param task The task to submit
     * @param <T>  The result type of the task
     * @return A Future representing pending completion of the task
     */
    <T> Future<T> submit(Callable<T> task);

    /**
     * Shuts down the executor and returns the tasks that never started.
     *
     * @return A list of runnables that were not executed
     */
    List<Runnable> shutdownNow();

    @Override
    default void close() {
        shutdownNow();
    }
}
