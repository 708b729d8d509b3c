package com.ryuqq.multiprocess.adapter.runner;

import com.ryuqq.multiprocess.core.capsule.FailureCapsule;
import com.ryuqq.multiprocess.core.error.CapsuleException;
import com.ryuqq.multiprocess.core.error.RemoteWorkerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 워커가 보고한 FailureCapsule을 Coordinator 쪽에서 던질 예외로 변환.
 *
 * <p><strong>변환 규칙:</strong></p>
 * <ul>
 *   <li>재구성된 예외가 Error면 그대로 던짐 (예: AssertionError)</li>
 *   <li>Exception이면 그대로 반환 (checked 포함)</li>
 *   <li>그 외 Throwable은 RemoteWorkerException으로 감쌈</li>
 *   <li>재구성이 불가능하면 (CapsuleException) RemoteWorkerException으로 대체</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FailureRaiser {

    private static final Logger log = LoggerFactory.getLogger(FailureRaiser.class);

    /**
     * 캡슐을 던질 예외로 변환.
     *
     * @param workerName 실패를 보고한 워커 이름
     * @param capsule 보고된 캡슐
     * @param suppressed 함께 발생한 오케스트레이션 오류 (null 가능, suppressed로 첨부)
     * @return 던질 Exception
     * @throws Error 재구성된 실패가 Error인 경우 그대로
     */
    public Exception toRaisable(String workerName, FailureCapsule capsule, Throwable suppressed) {
        if (capsule == null) {
            throw new IllegalArgumentException("capsule cannot be null");
        }
        Throwable rebuilt = rebuild(workerName, capsule);
        if (suppressed != null) {
            rebuilt.addSuppressed(suppressed);
        }
        log.warn("Worker {} failed with {}", workerName, capsule.kind());

        if (rebuilt instanceof Error) {
            throw (Error) rebuilt;
        }
        if (rebuilt instanceof Exception) {
            return (Exception) rebuilt;
        }
        RemoteWorkerException wrapped = new RemoteWorkerException(capsule.kind(), capsule.message());
        wrapped.setStackTrace(capsule.stackTrace());
        wrapped.initCause(rebuilt);
        return wrapped;
    }

    private Throwable rebuild(String workerName, FailureCapsule capsule) {
        try {
            return capsule.reconstruct();
        } catch (CapsuleException e) {
            log.warn("Cannot recreate failure kind {} reported by worker {}: {}", capsule.kind(), workerName, e.getMessage());
            return capsule.reconstructOrSubstitute();
        }
    }
}
