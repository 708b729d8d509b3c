package com.ryuqq.multiprocess.core.worker;

/**
 * 실행 가능한 워커 명세 (불변 record).
 *
 * <p>워커 로직과 생성 인자를 {@link WorkerFactory}로 묶어 표현합니다.
 * 한 번의 실행에서 WorkerSpec 하나는 정확히 하나의 프로세스가 됩니다.</p>
 *
 * <p><strong>생성 방법:</strong></p>
 * <pre>{@code
 * WorkerSpec.of(EchoServerWorker.class);                         // 인자 없는 생성자
 * WorkerSpec.of("pub", () -> new PubServerWorker("prefix-a"));   // 직렬화 가능한 람다
 * Workers.builder("client").run((initial, shared) -> ...);       // 함수 조합
 * }</pre>
 *
 * @param name 워커 이름 (중복 허용, 1~255자)
 * @param factory 워커 유닛 생성 함수
 * @param background 백그라운드 워커 여부 (최종 대기 단계에서 종료를 기다리지 않음)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkerSpec(
    String name,
    WorkerFactory factory,
    boolean background
) {

    public WorkerSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (name.length() > 255) {
            throw new IllegalArgumentException("name length cannot exceed 255 characters");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
    }

    /**
     * 워커 클래스로부터 명세 생성 (이름 = 클래스 simple name).
     *
     * @param type 인자 없는 생성자를 가진 워커 클래스
     * @return WorkerSpec
     * @throws IllegalArgumentException type이 null인 경우
     */
    public static WorkerSpec of(Class<? extends WorkerUnit> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return new WorkerSpec(type.getSimpleName(), new ReflectiveWorkerFactory(type), false);
    }

    /**
     * 팩토리로부터 명세 생성.
     *
     * @param name 워커 이름
     * @param factory 워커 유닛 생성 함수
     * @return WorkerSpec
     */
    public static WorkerSpec of(String name, WorkerFactory factory) {
        return new WorkerSpec(name, factory, false);
    }

    /**
     * 백그라운드 워커로 표시한 새 인스턴스 생성.
     */
    public WorkerSpec asBackground() {
        return new WorkerSpec(name, factory, true);
    }

    /**
     * name만 변경한 새 인스턴스 생성.
     */
    public WorkerSpec withName(String name) {
        return new WorkerSpec(name, factory, background);
    }
}
