package com.ryuqq.multiprocess.adapter.process.wire;

import com.ryuqq.multiprocess.core.capsule.FailureCapsule;
import com.ryuqq.multiprocess.core.model.Options;

import java.util.Map;

/**
 * 소켓으로 주고받는 메시지 (불변 record, 한 줄의 JSON).
 *
 * <p>종류에 따라 사용하는 필드가 다르며, 사용하지 않는 필드는 null입니다.</p>
 *
 * @param type 메시지 종류
 * @param workerName 워커 이름
 * @param options INIT / CONTRIBUTION / SHARED_OPTIONS의 옵션
 * @param failure FAILURE의 캡슐
 * @param spec INIT의 Base64 인코딩된 WorkerFactory
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ChannelMessage(
    MessageType type,
    String workerName,
    Map<String, Object> options,
    FailureCapsule failure,
    String spec
) {

    public ChannelMessage {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
    }

    public static ChannelMessage init(String workerName, Options initialOptions, String spec) {
        return new ChannelMessage(MessageType.INIT, workerName, initialOptions.asMap(), null, spec);
    }

    public static ChannelMessage contribution(String workerName, Options contribution) {
        return new ChannelMessage(MessageType.CONTRIBUTION, workerName, contribution.asMap(), null, null);
    }

    public static ChannelMessage sharedOptions(String workerName, Options sharedOptions) {
        return new ChannelMessage(MessageType.SHARED_OPTIONS, workerName, sharedOptions.asMap(), null, null);
    }

    public static ChannelMessage ready(String workerName) {
        return new ChannelMessage(MessageType.READY, workerName, null, null, null);
    }

    public static ChannelMessage run(String workerName) {
        return new ChannelMessage(MessageType.RUN, workerName, null, null, null);
    }

    public static ChannelMessage failure(String workerName, FailureCapsule capsule) {
        return new ChannelMessage(MessageType.FAILURE, workerName, null, capsule, null);
    }

    /**
     * options 필드를 Options로 변환.
     *
     * @return Options (필드가 없으면 빈 Options)
     * @throws WireFormatException 옵션 값이 JSON 타입으로 표현되지 않는 경우
     */
    public Options optionsOrEmpty() {
        try {
            return Options.of(options);
        } catch (IllegalArgumentException e) {
            throw new WireFormatException("Invalid options in " + type + " message: " + e.getMessage(), e);
        }
    }
}
