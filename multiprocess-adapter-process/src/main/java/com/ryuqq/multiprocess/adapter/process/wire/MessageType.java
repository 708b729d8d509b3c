package com.ryuqq.multiprocess.adapter.process.wire;

/**
 * 채널 메시지 종류.
 *
 * <p><strong>방향:</strong></p>
 * <ul>
 *   <li>Coordinator → 워커: INIT, SHARED_OPTIONS, RUN</li>
 *   <li>워커 → Coordinator: CONTRIBUTION, READY, FAILURE</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum MessageType {

    /**
     * 연결 직후 첫 메시지: 워커 이름, 초기 옵션, 직렬화된 WorkerFactory.
     */
    INIT,
    CONTRIBUTION,
    SHARED_OPTIONS,
    READY,
    RUN,
    FAILURE
}
