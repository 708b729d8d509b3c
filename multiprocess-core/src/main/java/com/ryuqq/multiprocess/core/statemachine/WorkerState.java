package com.ryuqq.multiprocess.core.statemachine;

/**
 * 워커 유닛의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CREATED
 *    │
 *    ▼ (기여 옵션 전송)
 * CONTRIBUTION_SENT
 *    │
 *    ▼
 * AWAITING_SHARED_OPTIONS
 *    │
 *    ▼ (setup 완료)
 * SETUP_COMPLETE
 *    │
 *    ▼ (준비 신호)
 * READY_SIGNALED
 *    │
 *    ▼
 * AWAITING_RUN_SIGNAL
 *    │
 *    ▼ (실행 신호 수신)
 * RUNNING
 *    │
 *    ├─► COMPLETED ─┐
 *    │              ├─► TORN_DOWN
 *    └─► FAILED ────┘
 *
 * FAILED는 TORN_DOWN 이전의 모든 비종료 상태에서 진입 가능합니다.
 * 역방향 전이 불가 (불변식)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum WorkerState {

    CREATED,
    CONTRIBUTION_SENT,
    AWAITING_SHARED_OPTIONS,
    SETUP_COMPLETE,
    READY_SIGNALED,
    AWAITING_RUN_SIGNAL,
    RUNNING,

    /**
     * run 정상 완료.
     */
    COMPLETED,

    /**
     * contribute/setup/run 중 처리되지 않은 실패.
     */
    FAILED,

    /**
     * teardown 완료 (최종 상태).
     */
    TORN_DOWN;

    /**
     * 실행 결과가 결정된 상태인지 확인.
     *
     * @return COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isOutcome() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * 최종 상태인지 확인.
     *
     * @return TORN_DOWN인 경우 true
     */
    public boolean isTerminal() {
        return this == TORN_DOWN;
    }
}
