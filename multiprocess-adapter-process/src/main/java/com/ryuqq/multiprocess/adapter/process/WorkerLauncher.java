package com.ryuqq.multiprocess.adapter.process;

import com.ryuqq.multiprocess.adapter.process.wire.WorkerSpecCodec;
import com.ryuqq.multiprocess.core.statemachine.WorkerState;
import com.ryuqq.multiprocess.core.worker.WorkerFactory;
import com.ryuqq.multiprocess.core.worker.WorkerLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 워커 프로세스의 진입점.
 *
 * <p>사용법: {@code WorkerLauncher <host> <port> <connectTimeoutMs>}</p>
 *
 * <p><strong>종료 코드:</strong></p>
 * <ul>
 *   <li>0: run 정상 완료</li>
 *   <li>1: 실패 (FailureCapsule 보고됨)</li>
 *   <li>2: Coordinator 연결 실패 또는 연결 끊김</li>
 *   <li>64: 잘못된 실행 인자</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(WorkerLauncher.class);

    public static final int EXIT_COMPLETED = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_CONNECTION_LOST = 2;
    public static final int EXIT_USAGE = 64;

    private WorkerLauncher() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void main(String[] args) {
        System.exit(launch(args));
    }

    /**
     * 인자를 해석하고 생명주기를 실행.
     *
     * @param args host, port, connectTimeoutMs
     * @return 종료 코드
     */
    static int launch(String[] args) {
        if (args == null || args.length != 3) {
            log.error("Usage: WorkerLauncher <host> <port> <connectTimeoutMs>");
            return EXIT_USAGE;
        }
        int port;
        int timeoutMs;
        try {
            port = Integer.parseInt(args[1]);
            timeoutMs = Integer.parseInt(args[2]);
        } catch (NumberFormatException e) {
            log.error("Invalid port or timeout: {} {}", args[1], args[2]);
            return EXIT_USAGE;
        }

        AtomicBoolean finished = new AtomicBoolean();
        Runnable onDisconnect = () -> {
            if (!finished.get()) {
                log.error("Coordinator connection lost, exiting");
                Runtime.getRuntime().halt(EXIT_CONNECTION_LOST);
            }
        };

        SocketWorkerEndpoint endpoint;
        try {
            endpoint = SocketWorkerEndpoint.connect(args[0], port, timeoutMs, onDisconnect);
        } catch (IOException | RuntimeException e) {
            log.error("Cannot connect to coordinator at {}:{}", args[0], port, e);
            return EXIT_CONNECTION_LOST;
        }

        try (endpoint) {
            String encodedFactory = endpoint.encodedFactory();
            WorkerFactory factory = () -> WorkerSpecCodec.decode(encodedFactory).create();
            WorkerState outcome = new WorkerLifecycle(
                endpoint.workerName(), factory, endpoint.initialOptions(), endpoint).execute();
            finished.set(true);
            log.debug("Worker {} finished: {}", endpoint.workerName(), outcome);
            return outcome == WorkerState.COMPLETED ? EXIT_COMPLETED : EXIT_FAILED;
        }
    }
}
