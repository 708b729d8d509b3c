package com.ryuqq.multiprocess.core.worker;

/**
 * 함수 조합으로 WorkerSpec을 만드는 빌더 진입점.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * WorkerSpec server = Workers.builder("server")
 *     .contribute(initial -> Options.of("server.port", 9000))
 *     .background()
 *     .run((initial, shared) -> serveForever());
 *
 * WorkerSpec client = Workers.task("client", () -> callServer());
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Workers {

    private Workers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * 본문만 있는 워커 생성.
     *
     * @param name 워커 이름
     * @param body 실행 본문 (초기 옵션, 공유 옵션)
     * @return WorkerSpec
     */
    public static WorkerSpec of(String name, WorkerFunctions.Body body) {
        return builder(name).run(body);
    }

    /**
     * 인자 없는 작업 하나로 워커 생성.
     *
     * @param name 워커 이름
     * @param task 작업
     * @return WorkerSpec
     * @throws IllegalArgumentException task가 null인 경우
     */
    public static WorkerSpec task(String name, WorkerFunctions.Task task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        return builder(name).run((initial, shared) -> task.run());
    }

    /**
     * 조합된 함수들로 WorkerSpec 생성.
     *
     * @param name 워커 이름
     * @param functions 워커 구성 함수
     * @param background 백그라운드 워커 여부
     * @return WorkerSpec
     */
    public static WorkerSpec compose(String name, WorkerFunctions functions, boolean background) {
        if (functions == null) {
            throw new IllegalArgumentException("functions cannot be null");
        }
        return new WorkerSpec(name, () -> new ComposedWorker(functions), background);
    }

    /**
     * WorkerSpec 빌더.
     */
    public static final class Builder {

        private final String name;
        private WorkerFunctions.Contribute contribute;
        private WorkerFunctions.Setup setup;
        private WorkerFunctions.Teardown teardown;
        private boolean background;

        private Builder(String name) {
            this.name = name;
        }

        public Builder contribute(WorkerFunctions.Contribute contribute) {
            this.contribute = contribute;
            return this;
        }

        public Builder setup(WorkerFunctions.Setup setup) {
            this.setup = setup;
            return this;
        }

        public Builder teardown(WorkerFunctions.Teardown teardown) {
            this.teardown = teardown;
            return this;
        }

        public Builder background() {
            this.background = true;
            return this;
        }

        /**
         * 실행 본문을 지정하고 WorkerSpec 생성.
         *
         * @param body 실행 본문
         * @return WorkerSpec
         */
        public WorkerSpec run(WorkerFunctions.Body body) {
            return compose(name, new WorkerFunctions(contribute, setup, body, teardown), background);
        }
    }
}
