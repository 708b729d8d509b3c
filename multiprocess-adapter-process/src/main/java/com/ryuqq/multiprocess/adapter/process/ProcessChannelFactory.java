package com.ryuqq.multiprocess.adapter.process;

import com.ryuqq.multiprocess.adapter.process.wire.WorkerSpecCodec;
import com.ryuqq.multiprocess.core.error.OrchestrationException;
import com.ryuqq.multiprocess.core.model.Options;
import com.ryuqq.multiprocess.core.model.RunBudget;
import com.ryuqq.multiprocess.core.spi.Channel;
import com.ryuqq.multiprocess.core.spi.ChannelFactory;
import com.ryuqq.multiprocess.core.worker.WorkerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.List;

/**
 * 워커마다 별도의 JVM 프로세스를 띄우는 ChannelFactory.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>WorkerFactory를 직렬화 (실패 시 프로세스를 띄우기 전에 오류)</li>
 *   <li>루프백 주소의 임시 포트로 ServerSocket 생성</li>
 *   <li>{@link WorkerLauncher}를 메인 클래스로 하는 JVM 시작 (포트를 인자로 전달)</li>
 *   <li>ProcessChannel이 연결을 받아 INIT 메시지를 보냄</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ProcessChannelFactory implements ChannelFactory {

    private static final Logger log = LoggerFactory.getLogger(ProcessChannelFactory.class);

    private final ProcessLaunchConfig launchConfig;

    /**
     * 생성자 (현재 JVM 기준 기본 설정).
     */
    public ProcessChannelFactory() {
        this(new ProcessLaunchConfig());
    }

    /**
     * 생성자.
     *
     * @param launchConfig 워커 JVM 실행 설정
     * @throws IllegalArgumentException launchConfig가 null인 경우
     */
    public ProcessChannelFactory(ProcessLaunchConfig launchConfig) {
        if (launchConfig == null) {
            throw new IllegalArgumentException("launchConfig cannot be null");
        }
        this.launchConfig = launchConfig;
    }

    @Override
    public Channel open(WorkerSpec spec, Options initialOptions, RunBudget budget) {
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        if (budget == null) {
            throw new IllegalArgumentException("budget cannot be null");
        }
        String encodedFactory = WorkerSpecCodec.encode(spec.name(), spec.factory());

        ServerSocket server = null;
        try {
            server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
            List<String> command = launchConfig.command(WorkerLauncher.class.getName(), List.of(
                server.getInetAddress().getHostAddress(),
                String.valueOf(server.getLocalPort()),
                String.valueOf(budget.perOperationTimeoutMs())
            ));
            Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
            log.debug("Started worker {} as pid {} on port {}", spec.name(), process.pid(), server.getLocalPort());

            ProcessChannel channel = new ProcessChannel(
                spec, initialOptions == null ? Options.empty() : initialOptions, budget, encodedFactory, server, process);
            channel.start();
            return channel;
        } catch (IOException e) {
            closeServer(server, spec.name());
            throw new OrchestrationException(spec.name(), "Failed to start worker \"" + spec.name() + "\"", e);
        }
    }

    private static void closeServer(ServerSocket server, String workerName) {
        if (server == null) {
            return;
        }
        try {
            server.close();
        } catch (IOException e) {
            log.debug("Failed to close server socket of worker {}", workerName, e);
        }
    }
}
