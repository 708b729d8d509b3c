package com.ryuqq.multiprocess.core.error;

/**
 * 원래 타입으로 재구성할 수 없는 원격 워커 실패의 대체 예외.
 *
 * <p>원래 예외 타입 이름(kind)과 메시지를 텍스트로 담습니다.
 * 스택 트레이스는 캡슐에 기록된 위치로 채워집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RemoteWorkerException extends RuntimeException {

    private final String kind;
    private final String originalMessage;

    public RemoteWorkerException(String kind, String originalMessage) {
        super(originalMessage == null ? kind : kind + ": " + originalMessage);
        this.kind = kind;
        this.originalMessage = originalMessage;
    }

    /**
     * 원래 예외의 FQCN.
     */
    public String getKind() {
        return kind;
    }

    /**
     * 원래 예외의 메시지 (null 가능).
     */
    public String getOriginalMessage() {
        return originalMessage;
    }
}
