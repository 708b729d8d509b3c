/**
 * 워커 유닛 모델과 워커 측 생명주기 구동.
 *
 * <p>{@link com.ryuqq.multiprocess.core.worker.WorkerUnit}을 상속하거나
 * {@link com.ryuqq.multiprocess.core.worker.Workers} 빌더로 함수를 조합해 워커를 정의합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.multiprocess.core.worker;
