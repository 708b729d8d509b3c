package com.ryuqq.multiprocess.core.statemachine;

/**
 * 워커 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CREATED → CONTRIBUTION_SENT → AWAITING_SHARED_OPTIONS → SETUP_COMPLETE
 *       → READY_SIGNALED → AWAITING_RUN_SIGNAL → RUNNING → COMPLETED (순차)</li>
 *   <li>CREATED ~ RUNNING → FAILED</li>
 *   <li>COMPLETED, FAILED → TORN_DOWN</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>TORN_DOWN에서는 어떤 상태로도 전이 불가</li>
 *   <li>단계 건너뛰기 및 역방향 전이 불가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(WorkerState from, WorkerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case CREATED -> to == WorkerState.CONTRIBUTION_SENT || to == WorkerState.FAILED;
            case CONTRIBUTION_SENT -> to == WorkerState.AWAITING_SHARED_OPTIONS || to == WorkerState.FAILED;
            case AWAITING_SHARED_OPTIONS -> to == WorkerState.SETUP_COMPLETE || to == WorkerState.FAILED;
            case SETUP_COMPLETE -> to == WorkerState.READY_SIGNALED || to == WorkerState.FAILED;
            case READY_SIGNALED -> to == WorkerState.AWAITING_RUN_SIGNAL || to == WorkerState.FAILED;
            case AWAITING_RUN_SIGNAL -> to == WorkerState.RUNNING || to == WorkerState.FAILED;
            case RUNNING -> to == WorkerState.COMPLETED || to == WorkerState.FAILED;
            case COMPLETED, FAILED -> to == WorkerState.TORN_DOWN;
            case TORN_DOWN -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static WorkerState transition(WorkerState current, WorkerState next) {
        validate(current, next);
        return next;
    }
}
