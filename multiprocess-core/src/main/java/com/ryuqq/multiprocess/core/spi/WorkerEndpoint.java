package com.ryuqq.multiprocess.core.spi;

import com.ryuqq.multiprocess.core.capsule.FailureCapsule;
import com.ryuqq.multiprocess.core.model.Options;

/**
 * 워커 측에서 바라본 채널 SPI.
 *
 * <p>워커 프로세스 내부에서 {@link com.ryuqq.multiprocess.core.worker.WorkerLifecycle}이 사용합니다.
 * 워커 측 대기는 시간 제한이 없으며, Coordinator 연결이 끊기면
 * {@link com.ryuqq.multiprocess.core.error.OrchestrationException}으로 끝납니다.
 * 시간 제한은 Coordinator 쪽이 책임집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkerEndpoint {

    void sendContribution(Options contribution);

    Options awaitSharedOptions();

    void signalReady();

    void awaitRunSignal();

    /**
     * FailureCapsule 보고.
     *
     * @param capsule 포착된 실패
     */
    void reportFailure(FailureCapsule capsule);
}
