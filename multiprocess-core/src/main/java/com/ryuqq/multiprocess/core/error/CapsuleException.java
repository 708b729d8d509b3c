package com.ryuqq.multiprocess.core.error;

/**
 * FailureCapsule을 원래 예외 타입으로 재구성할 수 없음.
 *
 * <p>예외 클래스를 이쪽 클래스패스에서 찾을 수 없거나, Throwable이 아니거나,
 * 사용할 수 있는 생성자가 없는 경우 발생합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CapsuleException extends RuntimeException {

    private final String kind;

    public CapsuleException(String kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
