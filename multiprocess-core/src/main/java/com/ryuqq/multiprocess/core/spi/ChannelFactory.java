package com.ryuqq.multiprocess.core.spi;

import com.ryuqq.multiprocess.core.model.Options;
import com.ryuqq.multiprocess.core.model.RunBudget;
import com.ryuqq.multiprocess.core.worker.WorkerSpec;

/**
 * 워커를 띄우고 그 워커와 연결된 Channel을 만드는 SPI.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ChannelFactory {

    /**
     * 워커 하나를 시작하고 Channel을 반환.
     *
     * <p>이 메서드는 워커 시작만 요청하고 즉시 반환합니다 (연결/기여 대기 없음).</p>
     *
     * @param spec 워커 명세
     * @param initialOptions 모든 워커에 동일하게 전달될 초기 옵션
     * @param budget 송수신 타임아웃 예산
     * @return 시작된 워커의 Channel
     * @throws com.ryuqq.multiprocess.core.error.OrchestrationException 워커를 시작할 수 없는 경우
     */
    Channel open(WorkerSpec spec, Options initialOptions, RunBudget budget);
}
