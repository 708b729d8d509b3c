package com.ryuqq.multiprocess.core.error;

/**
 * 오케스트레이션 구조적 실패.
 *
 * <p>워커가 보고 전에 죽었거나, 채널이 끊겼거나, 워커를 띄울 수 없는 경우 등
 * 실행을 계속할 수 없는 상황을 나타냅니다. 항상 치명적이며 실행을 중단시킵니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OrchestrationException extends RuntimeException {

    private final String workerName;

    public OrchestrationException(String message) {
        this(null, message, null);
    }

    public OrchestrationException(String workerName, String message) {
        this(workerName, message, null);
    }

    public OrchestrationException(String workerName, String message, Throwable cause) {
        super(message, cause);
        this.workerName = workerName;
    }

    /**
     * 원인이 된 워커 이름.
     *
     * @return 워커 이름 (특정 워커와 무관하면 null)
     */
    public String getWorkerName() {
        return workerName;
    }

    /**
     * "died prematurely" 예외 생성.
     *
     * @param workerName 워커 이름
     * @return OrchestrationException
     */
    public static OrchestrationException diedPrematurely(String workerName) {
        return new OrchestrationException(workerName, "Worker \"" + workerName + "\" has died prematurely");
    }
}
