package com.ryuqq.multiprocess.adapter.process.wire;

import com.ryuqq.multiprocess.core.error.OrchestrationException;

/**
 * 채널 메시지를 인코딩/디코딩할 수 없음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class WireFormatException extends OrchestrationException {

    public WireFormatException(String message, Throwable cause) {
        super(null, message, cause);
    }
}
