package com.ryuqq.multiprocess.testkit;

import com.ryuqq.multiprocess.adapter.process.ProcessChannelFactory;
import com.ryuqq.multiprocess.adapter.process.ProcessLaunchConfig;
import com.ryuqq.multiprocess.adapter.runner.CoordinatorConfig;
import com.ryuqq.multiprocess.adapter.runner.StagedCoordinator;
import com.ryuqq.multiprocess.application.coordinator.Coordinator;
import com.ryuqq.multiprocess.application.coordinator.OptionsSeed;
import com.ryuqq.multiprocess.core.model.RunBudget;
import com.ryuqq.multiprocess.core.worker.WorkerSpec;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for assembling a multi-process run out of worker specs.
 *
 * <p>Workers are spawned as separate JVMs in registration order. Registration order also
 * decides which contribution wins when two workers contribute the same option key.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>{@code
 * MultiprocessRun.builder()
 *     .worker(Workers.builder("server")
 *         .contribute(initial -> Options.of("port", 9000))
 *         .background()
 *         .run((initial, shared) -> serve(shared.getInt("port"))))
 *     .worker(Workers.of("client", (initial, shared) -> call(shared.getInt("port"))))
 *     .runtimeTimeoutMs(10_000)
 *     .build()
 *     .run();
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MultiprocessRun {

    private MultiprocessRun() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder producing a process-backed {@link Coordinator}.
     */
    public static final class Builder {

        private final List<WorkerSpec> workers = new ArrayList<>();
        private OptionsSeed seed = OptionsSeed.empty();
        private RunBudget budget = new RunBudget();
        private long pollIntervalMs = CoordinatorConfig.DEFAULT_POLL_INTERVAL_MS;
        private long readyProbeMs = CoordinatorConfig.DEFAULT_READY_PROBE_MS;
        private ProcessLaunchConfig launchConfig = new ProcessLaunchConfig();

        private Builder() {
        }

        public Builder worker(WorkerSpec spec) {
            if (spec == null) {
                throw new IllegalArgumentException("spec cannot be null");
            }
            workers.add(spec);
            return this;
        }

        public Builder workers(List<WorkerSpec> specs) {
            if (specs == null) {
                throw new IllegalArgumentException("specs cannot be null");
            }
            specs.forEach(this::worker);
            return this;
        }

        /**
         * Sets the function producing the initial options handed to every worker.
         *
         * @param seed called exactly once per run, in the calling process
         * @return this builder
         */
        public Builder initialOptions(OptionsSeed seed) {
            if (seed == null) {
                throw new IllegalArgumentException("seed cannot be null");
            }
            this.seed = seed;
            return this;
        }

        public Builder perOperationTimeoutMs(long perOperationTimeoutMs) {
            this.budget = budget.withPerOperationTimeoutMs(perOperationTimeoutMs);
            return this;
        }

        /**
         * Sets the total wall-clock limit for the run stage.
         *
         * @param runtimeTimeoutMs limit in milliseconds, 0 for unbounded
         * @return this builder
         */
        public Builder runtimeTimeoutMs(long runtimeTimeoutMs) {
            this.budget = budget.withRuntimeTimeoutMs(runtimeTimeoutMs);
            return this;
        }

        public Builder pollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
            return this;
        }

        public Builder readyProbeMs(long readyProbeMs) {
            this.readyProbeMs = readyProbeMs;
            return this;
        }

        public Builder launchConfig(ProcessLaunchConfig launchConfig) {
            if (launchConfig == null) {
                throw new IllegalArgumentException("launchConfig cannot be null");
            }
            this.launchConfig = launchConfig;
            return this;
        }

        /**
         * Builds the coordinator. Nothing is spawned until {@link Coordinator#run()}.
         *
         * @return coordinator over the registered workers
         * @throws IllegalArgumentException if no worker was registered or a setting is invalid
         */
        public Coordinator build() {
            CoordinatorConfig config = new CoordinatorConfig(budget, pollIntervalMs, readyProbeMs);
            return new StagedCoordinator(
                List.copyOf(workers), seed, new ProcessChannelFactory(launchConfig), config
            );
        }
    }
}
