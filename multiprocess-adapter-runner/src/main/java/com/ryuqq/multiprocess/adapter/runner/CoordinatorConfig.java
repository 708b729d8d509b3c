package com.ryuqq.multiprocess.adapter.runner;

import com.ryuqq.multiprocess.core.model.RunBudget;

/**
 * StagedCoordinator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>budget: 송수신 1회당 타임아웃과 전체 실행 타임아웃 (기본 5000ms / 무제한)</li>
 *   <li>pollIntervalMs: 공동 대기 단계에서 워커 하나당 대기 조각 (기본 100ms)</li>
 *   <li>readyProbeMs: 준비 배리어에서 워커 하나당 준비 신호 확인 대기 (기본 500ms)</li>
 * </ul>
 *
 * <p>pollIntervalMs가 작을수록 실패 감지가 빨라지지만 폴링 횟수가 늘어납니다.
 * 전체 실행 타임아웃의 초과 감지 지연은 대략 (살아있는 워커 수 × pollIntervalMs)입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param budget 타임아웃 예산 (null이 아니어야 함)
 * @param pollIntervalMs 공동 대기 조각 (밀리초, 양수여야 함)
 * @param readyProbeMs 준비 확인 대기 (밀리초, 양수여야 함)
 */
public record CoordinatorConfig(
    RunBudget budget,
    long pollIntervalMs,
    long readyProbeMs
) {

    public static final long DEFAULT_POLL_INTERVAL_MS = 100;
    public static final long DEFAULT_READY_PROBE_MS = 500;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: budget=RunBudget 기본값, pollIntervalMs=100ms, readyProbeMs=500ms</p>
     */
    public CoordinatorConfig() {
        this(new RunBudget(), DEFAULT_POLL_INTERVAL_MS, DEFAULT_READY_PROBE_MS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CoordinatorConfig {
        if (budget == null) {
            throw new IllegalArgumentException("budget cannot be null");
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalMs must be positive (current: " + pollIntervalMs + ")"
            );
        }
        if (readyProbeMs <= 0) {
            throw new IllegalArgumentException(
                "readyProbeMs must be positive (current: " + readyProbeMs + ")"
            );
        }
    }

    /**
     * budget만 변경한 새 인스턴스 생성.
     */
    public CoordinatorConfig withBudget(RunBudget budget) {
        return new CoordinatorConfig(budget, pollIntervalMs, readyProbeMs);
    }

    /**
     * pollIntervalMs만 변경한 새 인스턴스 생성.
     */
    public CoordinatorConfig withPollIntervalMs(long pollIntervalMs) {
        return new CoordinatorConfig(budget, pollIntervalMs, readyProbeMs);
    }

    /**
     * readyProbeMs만 변경한 새 인스턴스 생성.
     */
    public CoordinatorConfig withReadyProbeMs(long readyProbeMs) {
        return new CoordinatorConfig(budget, pollIntervalMs, readyProbeMs);
    }
}
