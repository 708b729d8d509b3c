package com.ryuqq.multiprocess.core.spi;

/**
 * 채널이 소유한 메시지 슬롯.
 *
 * <p>타임아웃과 오류를 어느 슬롯에서 발생했는지 귀속하는 데 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ChannelSlot {

    /**
     * 워커 → Coordinator: 기여 옵션.
     */
    CONTRIBUTION,

    /**
     * Coordinator → 워커: 병합된 공유 옵션 브로드캐스트.
     */
    SHARED_OPTIONS,

    /**
     * 워커 → Coordinator: 준비 신호.
     */
    READY,

    /**
     * Coordinator → 워커: 실행 신호.
     */
    RUN,

    /**
     * 워커 → Coordinator: FailureCapsule.
     */
    FAILURE
}
