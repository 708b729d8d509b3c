package com.ryuqq.multiprocess.core.worker;

import java.io.Serializable;

/**
 * 워커 유닛 생성 함수.
 *
 * <p>프로세스 경계를 넘어 전달되므로 {@link Serializable}입니다.
 * 람다로 작성할 경우 캡처하는 값도 모두 직렬화 가능해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface WorkerFactory extends Serializable {

    /**
     * 워커 프로세스 안에서 새 워커 유닛 생성.
     *
     * @return 워커 유닛
     * @throws Exception 생성 실패 시
     */
    WorkerUnit create() throws Exception;
}
