/**
 * Host-facing facade for running tests across several JVMs.
 *
 * <ul>
 *   <li>{@link com.ryuqq.multiprocess.testkit.MultiprocessRun}: register workers, seed and timeouts, then run</li>
 *   <li>{@link com.ryuqq.multiprocess.testkit.TimeLimit}: one task in its own JVM under a wall-clock limit</li>
 *   <li>{@code contract}: JUnit 5 base class and marker helpers for process-level assertions</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.multiprocess.testkit;
