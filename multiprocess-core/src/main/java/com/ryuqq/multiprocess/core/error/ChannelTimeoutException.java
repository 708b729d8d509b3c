package com.ryuqq.multiprocess.core.error;

import com.ryuqq.multiprocess.core.spi.ChannelSlot;

/**
 * 채널 송수신 1회가 perOperationTimeout을 초과.
 *
 * <p>항상 특정 워커와 슬롯에 귀속되며, 재시도 없이 그대로 전파됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ChannelTimeoutException extends OrchestrationException {

    private final ChannelSlot slot;
    private final long timeoutMs;

    public ChannelTimeoutException(String workerName, ChannelSlot slot, long timeoutMs) {
        super(workerName, String.format(
            "Timed out waiting for worker \"%s\" on %s after %d ms", workerName, slot, timeoutMs));
        this.slot = slot;
        this.timeoutMs = timeoutMs;
    }

    public ChannelSlot getSlot() {
        return slot;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
