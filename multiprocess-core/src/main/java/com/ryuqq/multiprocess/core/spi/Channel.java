package com.ryuqq.multiprocess.core.spi;

import com.ryuqq.multiprocess.core.capsule.FailureCapsule;
import com.ryuqq.multiprocess.core.model.Options;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * 워커 하나에 대한 Coordinator 측 핸들 SPI.
 *
 * <p>워커별로 네 개의 독립된 메시지 슬롯(기여 옵션, 공유 옵션, 준비 신호, 실행 신호)과
 * 실패 슬롯, 그리고 생존 확인/강제 종료 핸들을 소유합니다.</p>
 *
 * <p><strong>소유권:</strong></p>
 * <ul>
 *   <li>Channel은 Coordinator만 소유합니다. 짝이 되는 워커는 채널을 통해서만 통신합니다.</li>
 *   <li>하나의 채널을 여러 소비자가 공유하지 않습니다.</li>
 * </ul>
 *
 * <p><strong>타임아웃:</strong> 모든 송수신은 RunBudget.perOperationTimeoutMs로 제한되며,
 * 초과 시 워커 이름이 귀속된 {@link com.ryuqq.multiprocess.core.error.ChannelTimeoutException}이 발생합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Channel {

    /**
     * 워커 이름.
     *
     * @return 워커 이름
     */
    String workerName();

    /**
     * 백그라운드 워커인지 확인.
     *
     * <p>백그라운드 워커는 모든 배리어에 참여하지만, 최종 대기 단계에서 종료를 기다리지 않습니다.</p>
     *
     * @return 백그라운드 워커면 true
     */
    boolean isBackground();

    /**
     * 워커의 기여 옵션 수신.
     *
     * @return 워커가 보고한 기여 옵션
     * @throws com.ryuqq.multiprocess.core.error.ChannelTimeoutException 타임아웃 내에 도착하지 않은 경우
     * @throws com.ryuqq.multiprocess.core.error.OrchestrationException 워커가 기여 전에 죽었거나 실패를 보고한 경우
     */
    Options receiveContribution();

    /**
     * 병합된 공유 옵션 전송.
     *
     * @param sharedOptions 공유 옵션
     * @throws com.ryuqq.multiprocess.core.error.ChannelTimeoutException 타임아웃 내에 전달되지 않은 경우
     * @throws com.ryuqq.multiprocess.core.error.OrchestrationException 전송 불가 (연결 끊김 등)
     */
    void sendSharedOptions(Options sharedOptions);

    /**
     * 준비 신호 확인.
     *
     * <p>최대 intervalMs만큼 대기합니다. 예외를 던지지 않습니다.</p>
     *
     * @param intervalMs 대기 시간 (밀리초)
     * @return 준비 신호를 받았으면 true
     */
    boolean probeReady(long intervalMs);

    /**
     * 실행 신호 전송.
     *
     * @throws com.ryuqq.multiprocess.core.error.ChannelTimeoutException 타임아웃 내에 전달되지 않은 경우
     * @throws com.ryuqq.multiprocess.core.error.OrchestrationException 전송 불가 (연결 끊김 등)
     */
    void sendRunSignal();

    /**
     * 실패 슬롯 확인 (소비).
     *
     * <p>살아있는 워커는 즉시 반환합니다. 이미 종료된 워커는 보낸 메시지가 모두 수신될 때까지
     * (최대 perOperationTimeoutMs) 기다린 뒤 반환합니다. 캡슐은 최대 한 번만 반환됩니다.</p>
     *
     * @return 보고된 FailureCapsule (없으면 빈 Optional)
     */
    Optional<FailureCapsule> pollFailure();

    /**
     * 워커 종료를 최대 waitMs만큼 대기 (join slice).
     *
     * @param waitMs 대기 시간 (밀리초)
     * @return 워커가 종료되었으면 true
     * @throws com.ryuqq.multiprocess.core.error.OrchestrationException 대기 중 인터럽트 발생 시
     */
    boolean awaitExit(long waitMs);

    /**
     * 워커 생존 여부.
     *
     * @return 살아있으면 true
     */
    boolean isAlive();

    /**
     * 워커 종료 코드.
     *
     * @return 종료된 경우 종료 코드, 살아있으면 빈 OptionalInt
     */
    OptionalInt exitCode();

    /**
     * 워커 강제 종료.
     *
     * <p>OS가 종료를 확인할 때까지 반복하며, 여러 번 호출해도 안전합니다 (멱등).</p>
     */
    void terminate();
}
