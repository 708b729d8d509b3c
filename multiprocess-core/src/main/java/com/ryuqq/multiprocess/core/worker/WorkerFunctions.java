package com.ryuqq.multiprocess.core.worker;

import com.ryuqq.multiprocess.core.model.Options;

import java.io.Serializable;

/**
 * 함수 조합으로 만드는 워커의 구성 요소 (불변 record).
 *
 * <p>각 함수는 직렬화 가능한 람다여야 합니다. 테스트 클래스의 인스턴스 필드를 참조하면
 * 테스트 인스턴스 자체가 캡처되어 직렬화에 실패하므로, 지역 변수나 static 멤버만 사용하세요.</p>
 *
 * @param contribute 기여 옵션 함수
 * @param setup 준비 함수
 * @param body 실행 본문
 * @param teardown 정리 함수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkerFunctions(
    Contribute contribute,
    Setup setup,
    Body body,
    Teardown teardown
) implements Serializable {

    private static final long serialVersionUID = 1L;

    public WorkerFunctions {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (contribute == null) {
            contribute = initial -> Options.empty();
        }
        if (setup == null) {
            setup = (initial, shared) -> { };
        }
        if (teardown == null) {
            teardown = () -> { };
        }
    }

    @FunctionalInterface
    public interface Contribute extends Serializable {
        Options contribute(Options initialOptions) throws Exception;
    }

    @FunctionalInterface
    public interface Setup extends Serializable {
        void setup(Options initialOptions, Options sharedOptions) throws Exception;
    }

    /**
     * 실행 본문. 초기 옵션과 공유 옵션을 모두 받습니다.
     */
    @FunctionalInterface
    public interface Body extends Serializable {
        void run(Options initialOptions, Options sharedOptions) throws Exception;
    }

    @FunctionalInterface
    public interface Teardown extends Serializable {
        void teardown() throws Exception;
    }

    /**
     * 인자 없는 단일 작업 (TimeLimit 등에서 사용).
     */
    @FunctionalInterface
    public interface Task extends Serializable {
        void run() throws Exception;
    }
}
