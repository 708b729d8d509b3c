package com.ryuqq.multiprocess.core.capsule;

/**
 * 캡슐에 기록된 스택 프레임 하나의 위치 정보.
 *
 * <p>살아있는 프레임이 아니라 (위치, 줄 번호)만 담으므로 프로세스 경계를 넘어 전달할 수 있습니다.</p>
 *
 * @param declaringClass 선언 클래스 FQCN
 * @param methodName 메서드 이름
 * @param fileName 소스 파일 이름 (null 가능)
 * @param lineNumber 줄 번호 (알 수 없으면 음수)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CapsuleFrame(
    String declaringClass,
    String methodName,
    String fileName,
    int lineNumber
) {

    public CapsuleFrame {
        if (declaringClass == null || declaringClass.isBlank()) {
            throw new IllegalArgumentException("declaringClass cannot be null or blank");
        }
        if (methodName == null || methodName.isBlank()) {
            throw new IllegalArgumentException("methodName cannot be null or blank");
        }
    }

    static CapsuleFrame from(StackTraceElement element) {
        return new CapsuleFrame(
            element.getClassName(),
            element.getMethodName(),
            element.getFileName(),
            element.getLineNumber()
        );
    }

    /**
     * 합성 StackTraceElement로 변환.
     *
     * @return StackTraceElement
     */
    public StackTraceElement toStackTraceElement() {
        return new StackTraceElement(declaringClass, methodName, fileName, lineNumber);
    }

    @Override
    public String toString() {
        return toStackTraceElement().toString();
    }
}
