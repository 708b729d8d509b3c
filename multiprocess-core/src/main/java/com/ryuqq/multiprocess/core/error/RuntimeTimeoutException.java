package com.ryuqq.multiprocess.core.error;

/**
 * 전체 실행 타임아웃(runtimeTimeoutMs) 초과.
 *
 * <p>워커가 아직 살아있더라도 전체 예산이 소진되면 발생하며, 남은 모든 워커의 종료를 유발합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RuntimeTimeoutException extends OrchestrationException {

    private final long runtimeTimeoutMs;

    public RuntimeTimeoutException(long runtimeTimeoutMs) {
        super(null, "Runtime for workers timed out after " + runtimeTimeoutMs + " ms");
        this.runtimeTimeoutMs = runtimeTimeoutMs;
    }

    public long getRuntimeTimeoutMs() {
        return runtimeTimeoutMs;
    }
}
