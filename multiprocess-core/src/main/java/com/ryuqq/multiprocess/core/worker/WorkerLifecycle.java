package com.ryuqq.multiprocess.core.worker;

import com.ryuqq.multiprocess.core.capsule.FailureCapsule;
import com.ryuqq.multiprocess.core.model.Options;
import com.ryuqq.multiprocess.core.spi.WorkerEndpoint;
import com.ryuqq.multiprocess.core.statemachine.StateTransition;
import com.ryuqq.multiprocess.core.statemachine.WorkerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 워커 프로세스 안에서 WorkerUnit의 생명주기를 구동.
 *
 * <p><strong>동작 순서:</strong></p>
 * <ol>
 *   <li>WorkerFactory로 유닛 생성, 이름/초기 옵션 연결</li>
 *   <li>contribute() → 기여 옵션 전송</li>
 *   <li>공유 옵션 대기 → setup(shared)</li>
 *   <li>준비 신호 전송 → 실행 신호 대기</li>
 *   <li>run()</li>
 *   <li>teardown() (모든 종료 경로)</li>
 * </ol>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>어느 단계에서든 던져진 것은 FailureCapsule로 포착되어 Coordinator에 보고됩니다.</li>
 *   <li>정상 완료 후 teardown이 실패하면 그 실패가 보고됩니다.</li>
 *   <li>이미 실패한 뒤 teardown이 실패하면 로그만 남깁니다 (첫 실패가 우선).</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkerLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WorkerLifecycle.class);

    private final String workerName;
    private final WorkerFactory factory;
    private final Options initialOptions;
    private final WorkerEndpoint endpoint;

    private WorkerState state = WorkerState.CREATED;

    /**
     * 생성자.
     *
     * @param workerName 워커 이름
     * @param factory 워커 유닛 생성 함수
     * @param initialOptions 초기 옵션
     * @param endpoint Coordinator와 연결된 워커 측 채널
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public WorkerLifecycle(String workerName, WorkerFactory factory, Options initialOptions, WorkerEndpoint endpoint) {
        if (workerName == null) {
            throw new IllegalArgumentException("workerName cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        this.workerName = workerName;
        this.factory = factory;
        this.initialOptions = initialOptions == null ? Options.empty() : initialOptions;
        this.endpoint = endpoint;
    }

    /**
     * 생명주기 전체 실행.
     *
     * <p>예외를 던지지 않습니다. 모든 실패는 채널로 보고되고 결과 상태에 반영됩니다.</p>
     *
     * @return COMPLETED 또는 FAILED (teardown 실패 포함)
     */
    public WorkerState execute() {
        WorkerUnit unit = null;
        WorkerState outcome;
        try {
            unit = factory.create();
            if (unit == null) {
                throw new IllegalStateException("WorkerFactory returned null for worker \"" + workerName + "\"");
            }
            unit.bind(workerName, initialOptions);

            Options contribution = unit.contribute();
            endpoint.sendContribution(contribution == null ? Options.empty() : contribution);
            moveTo(WorkerState.CONTRIBUTION_SENT);

            moveTo(WorkerState.AWAITING_SHARED_OPTIONS);
            Options sharedOptions = endpoint.awaitSharedOptions();
            unit.setup(sharedOptions);
            moveTo(WorkerState.SETUP_COMPLETE);

            endpoint.signalReady();
            moveTo(WorkerState.READY_SIGNALED);

            moveTo(WorkerState.AWAITING_RUN_SIGNAL);
            endpoint.awaitRunSignal();
            moveTo(WorkerState.RUNNING);
            log.debug("Worker {} released", workerName);

            unit.run();
            moveTo(WorkerState.COMPLETED);
        } catch (Throwable t) {
            log.debug("Worker {} failed in state {}", workerName, state, t);
            moveTo(WorkerState.FAILED);
            report(t);
        } finally {
            outcome = state;
            if (unit != null && !runTeardown(unit, outcome)) {
                outcome = WorkerState.FAILED;
            }
            moveTo(WorkerState.TORN_DOWN);
        }
        return outcome;
    }

    /**
     * 현재 상태.
     *
     * @return WorkerState
     */
    public WorkerState state() {
        return state;
    }

    private boolean runTeardown(WorkerUnit unit, WorkerState outcome) {
        try {
            unit.teardown();
            return true;
        } catch (Throwable t) {
            if (outcome == WorkerState.COMPLETED) {
                report(t);
            } else {
                log.warn("Teardown of worker {} failed after an earlier failure", workerName, t);
            }
            return false;
        }
    }

    private void report(Throwable failure) {
        try {
            endpoint.reportFailure(FailureCapsule.capture(failure));
        } catch (RuntimeException e) {
            log.error("Failed to report failure of worker {}", workerName, e);
        }
    }

    private void moveTo(WorkerState next) {
        state = StateTransition.transition(state, next);
    }
}
