package com.ryuqq.multiprocess.adapter.runner;

import com.ryuqq.multiprocess.core.capsule.FailureCapsule;

/**
 * 단계 진행 중 워커의 FailureCapsule을 발견했음을 run()까지 전달하는 내부 신호.
 */
final class WorkerFailureSignal extends RuntimeException {

    private final String workerName;
    private final transient FailureCapsule capsule;

    WorkerFailureSignal(String workerName, FailureCapsule capsule) {
        super("Worker \"" + workerName + "\" reported " + capsule.kind(), null, false, false);
        this.workerName = workerName;
        this.capsule = capsule;
    }

    String workerName() {
        return workerName;
    }

    FailureCapsule capsule() {
        return capsule;
    }
}
