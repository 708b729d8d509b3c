package com.ryuqq.multiprocess.core.model;

/**
 * 실행 타임아웃 예산 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>perOperationTimeoutMs: 채널 송수신 1회당 최대 대기 시간 (기본 5000ms)</li>
 *   <li>runtimeTimeoutMs: 모든 워커가 run 단계를 마칠 때까지의 전체 허용 시간 (기본 0 = 무제한)</li>
 * </ul>
 *
 * <p>Coordinator 생성 시 한 번 주어지며 이후 변경되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param perOperationTimeoutMs 송수신 1회당 타임아웃 (밀리초, 양수여야 함)
 * @param runtimeTimeoutMs 전체 실행 타임아웃 (밀리초, 0은 무제한, 음수 불가)
 */
public record RunBudget(
    long perOperationTimeoutMs,
    long runtimeTimeoutMs
) {

    public static final long DEFAULT_PER_OPERATION_TIMEOUT_MS = 5000;
    public static final long UNBOUNDED = 0;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: perOperationTimeoutMs=5000ms, runtimeTimeoutMs=0 (무제한)</p>
     */
    public RunBudget() {
        this(DEFAULT_PER_OPERATION_TIMEOUT_MS, UNBOUNDED);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RunBudget {
        if (perOperationTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "perOperationTimeoutMs must be positive (current: " + perOperationTimeoutMs + ")"
            );
        }
        if (runtimeTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "runtimeTimeoutMs cannot be negative (current: " + runtimeTimeoutMs + ")"
            );
        }
    }

    /**
     * 전체 실행 타임아웃이 설정되어 있는지 확인.
     *
     * @return runtimeTimeoutMs가 0보다 크면 true
     */
    public boolean hasRuntimeLimit() {
        return runtimeTimeoutMs > 0;
    }

    /**
     * perOperationTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public RunBudget withPerOperationTimeoutMs(long perOperationTimeoutMs) {
        return new RunBudget(perOperationTimeoutMs, runtimeTimeoutMs);
    }

    /**
     * runtimeTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public RunBudget withRuntimeTimeoutMs(long runtimeTimeoutMs) {
        return new RunBudget(perOperationTimeoutMs, runtimeTimeoutMs);
    }
}
