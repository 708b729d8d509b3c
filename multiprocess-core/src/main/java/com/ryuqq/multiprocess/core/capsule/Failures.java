package com.ryuqq.multiprocess.core.capsule;

import java.util.Optional;

/**
 * 실패 포착 유틸리티.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Failures {

    private Failures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 예외를 던질 수 있는 작업.
     */
    @FunctionalInterface
    public interface ThrowingTask {
        void run() throws Throwable;
    }

    /**
     * 작업을 실행하고, 던져진 모든 것을 캡슐로 포착.
     *
     * @param task 실행할 작업
     * @return 실패 시 FailureCapsule, 성공 시 빈 Optional
     * @throws IllegalArgumentException task가 null인 경우
     */
    public static Optional<FailureCapsule> storeAny(ThrowingTask task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        try {
            task.run();
            return Optional.empty();
        } catch (Throwable t) {
            return Optional.of(FailureCapsule.capture(t));
        }
    }
}
