package com.ryuqq.multiprocess.testkit;

import com.ryuqq.multiprocess.core.worker.WorkerFunctions;
import com.ryuqq.multiprocess.core.worker.Workers;

/**
 * Runs a single task in a separate JVM under a wall-clock limit.
 *
 * <p>When the task outlives the limit its process is killed and
 * {@link com.ryuqq.multiprocess.core.error.RuntimeTimeoutException} is thrown.
 * A failure raised by the task itself is rethrown with its original type and message.</p>
 *
 * <pre>{@code
 * TimeLimit.ofMillis(2_000).run(() -> server.awaitShutdown());
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TimeLimit {

    private static final String TASK_NAME = "time-limited-task";

    private final long limitMs;

    private TimeLimit(long limitMs) {
        if (limitMs <= 0) {
            throw new IllegalArgumentException("limitMs must be positive (current: " + limitMs + ")");
        }
        this.limitMs = limitMs;
    }

    public static TimeLimit ofMillis(long limitMs) {
        return new TimeLimit(limitMs);
    }

    public long limitMs() {
        return limitMs;
    }

    /**
     * Runs the task and waits for it to finish.
     *
     * @param task serializable task; must not capture non-serializable state
     * @throws Exception the task's own failure, or the timeout
     */
    public void run(WorkerFunctions.Task task) throws Exception {
        MultiprocessRun.builder()
            .worker(Workers.task(TASK_NAME, task))
            .runtimeTimeoutMs(limitMs)
            .build()
            .run();
    }
}
