package com.ryuqq.multiprocess.application.coordinator;

import com.ryuqq.multiprocess.core.model.Options;

/**
 * 초기 옵션 생성 함수.
 *
 * <p>Coordinator의 {@code run()} 한 번마다 정확히 한 번, 워커 시작 전에 호출됩니다.
 * 결과는 모든 워커에게 동일하게 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface OptionsSeed {

    /**
     * 초기 옵션 생성.
     *
     * @return 초기 옵션 (null이면 빈 옵션으로 취급)
     * @throws Exception 생성 실패 시 (워커를 하나도 띄우지 않고 그대로 전파)
     */
    Options seed() throws Exception;

    /**
     * 빈 옵션을 반환하는 시드.
     *
     * @return OptionsSeed
     */
    static OptionsSeed empty() {
        return Options::empty;
    }

    /**
     * 고정된 옵션을 반환하는 시드.
     *
     * @param options 초기 옵션
     * @return OptionsSeed
     */
    static OptionsSeed of(Options options) {
        return () -> options;
    }
}
