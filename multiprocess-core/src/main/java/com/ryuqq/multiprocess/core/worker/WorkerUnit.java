package com.ryuqq.multiprocess.core.worker;

import com.ryuqq.multiprocess.core.model.Options;

/**
 * 워커 프로세스 안에서 실행되는 작업 단위.
 *
 * <p>세 가지 동작을 재정의합니다. {@link #run()}만 필수입니다.</p>
 * <ul>
 *   <li>{@link #contribute()} - 공유 옵션에 기여할 값 (기본: 빈 옵션)</li>
 *   <li>{@link #setup(Options)} - 병합된 공유 옵션으로 준비 (기본: no-op)</li>
 *   <li>{@link #run()} - 실제 작업. 모든 워커가 setup을 마친 뒤에 동시에 시작됩니다.</li>
 * </ul>
 *
 * <p>{@link #teardown()}은 성공/실패와 관계없이 모든 종료 경로에서 호출됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * public class EchoServerWorker extends WorkerUnit {
 *     private ServerSocket server;
 *
 *     @Override
 *     public Options contribute() throws Exception {
 *         server = new ServerSocket(0);
 *         return Options.of("echo.port", server.getLocalPort());
 *     }
 *
 *     @Override
 *     public void run() throws Exception {
 *         while (true) { ... }
 *     }
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class WorkerUnit {

    private String workerName;
    private Options initialOptions = Options.empty();

    /**
     * 생명주기 시작 전에 워커 이름과 초기 옵션 연결.
     */
    final void bind(String workerName, Options initialOptions) {
        this.workerName = workerName;
        this.initialOptions = initialOptions == null ? Options.empty() : initialOptions;
    }

    /**
     * 이 워커의 이름.
     */
    protected final String workerName() {
        return workerName;
    }

    /**
     * 시드 함수가 만든 초기 옵션 (모든 워커에 동일).
     */
    protected final Options initialOptions() {
        return initialOptions;
    }

    public Options contribute() throws Exception {
        return Options.empty();
    }

    public void setup(Options sharedOptions) throws Exception {
    }

    public abstract void run() throws Exception;

    public void teardown() throws Exception {
    }
}
