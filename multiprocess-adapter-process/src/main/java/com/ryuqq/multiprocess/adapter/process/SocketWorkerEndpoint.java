package com.ryuqq.multiprocess.adapter.process;

import com.ryuqq.multiprocess.adapter.process.wire.ChannelMessage;
import com.ryuqq.multiprocess.adapter.process.wire.MessageType;
import com.ryuqq.multiprocess.adapter.process.wire.WireCodec;
import com.ryuqq.multiprocess.core.capsule.FailureCapsule;
import com.ryuqq.multiprocess.core.error.OrchestrationException;
import com.ryuqq.multiprocess.core.model.Options;
import com.ryuqq.multiprocess.core.spi.WorkerEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 워커 프로세스 쪽 소켓 엔드포인트.
 *
 * <p>Coordinator에 연결한 뒤 INIT 메시지를 동기적으로 읽고, 이후 수신은 데몬 스레드가 처리합니다.
 * 대기에는 시간 제한이 없으며 연결이 끊기면 {@link OrchestrationException}으로 끝납니다.</p>
 *
 * <p>생명주기 도중 연결이 끊기면 (Coordinator 프로세스가 사라진 경우) onDisconnect 콜백이 호출됩니다.
 * {@link #close()}로 직접 닫은 경우에는 호출되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SocketWorkerEndpoint implements WorkerEndpoint, Closeable {

    private static final Logger log = LoggerFactory.getLogger(SocketWorkerEndpoint.class);
    private static final long POLL_SLICE_MS = 100;

    private final Socket socket;
    private final BufferedReader reader;
    private final BufferedWriter writer;
    private final ChannelMessage init;
    private final Runnable onDisconnect;

    private final BlockingQueue<Options> sharedOptions = new ArrayBlockingQueue<>(1);
    private final CountDownLatch runSignal = new CountDownLatch(1);
    private final CountDownLatch disconnected = new CountDownLatch(1);
    private final Object writeLock = new Object();

    private volatile boolean closing;

    private SocketWorkerEndpoint(Socket socket, Runnable onDisconnect) throws IOException {
        this.socket = socket;
        this.onDisconnect = onDisconnect;
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
        this.init = readInit();
    }

    /**
     * Coordinator에 연결하고 INIT 메시지 수신.
     *
     * @param host Coordinator 주소
     * @param port Coordinator 포트
     * @param timeoutMs 연결 및 INIT 수신 타임아웃 (밀리초)
     * @param onDisconnect 생명주기 도중 연결이 끊겼을 때 호출할 콜백
     * @return 수신 스레드가 시작된 엔드포인트
     * @throws IOException 연결 실패, 타임아웃, INIT 형식 오류 시
     */
    public static SocketWorkerEndpoint connect(String host, int port, int timeoutMs, Runnable onDisconnect)
            throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), timeoutMs);
            socket.setSoTimeout(timeoutMs);
            SocketWorkerEndpoint endpoint = new SocketWorkerEndpoint(socket, onDisconnect);
            socket.setSoTimeout(0);
            endpoint.startReceiver();
            return endpoint;
        } catch (IOException | RuntimeException e) {
            socket.close();
            throw e;
        }
    }

    public String workerName() {
        return init.workerName();
    }

    public Options initialOptions() {
        return init.optionsOrEmpty();
    }

    /**
     * INIT으로 받은 Base64 인코딩 WorkerFactory.
     */
    public String encodedFactory() {
        return init.spec();
    }

    @Override
    public void sendContribution(Options contribution) {
        write(ChannelMessage.contribution(workerName(), contribution));
    }

    @Override
    public Options awaitSharedOptions() {
        while (true) {
            Options received = poll(sharedOptions);
            if (received != null) {
                return received;
            }
            if (disconnected.getCount() == 0) {
                Options late = sharedOptions.poll();
                if (late != null) {
                    return late;
                }
                throw connectionLost();
            }
        }
    }

    @Override
    public void signalReady() {
        write(ChannelMessage.ready(workerName()));
    }

    @Override
    public void awaitRunSignal() {
        try {
            while (!runSignal.await(POLL_SLICE_MS, TimeUnit.MILLISECONDS)) {
                if (disconnected.getCount() == 0) {
                    throw connectionLost();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestrationException(workerName(), "Interrupted while waiting for run signal", e);
        }
    }

    @Override
    public void reportFailure(FailureCapsule capsule) {
        write(ChannelMessage.failure(workerName(), capsule));
    }

    @Override
    public void close() {
        closing = true;
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Failed to close coordinator connection", e);
        }
    }

    private ChannelMessage readInit() throws IOException {
        String line = reader.readLine();
        if (line == null) {
            throw new IOException("Coordinator closed the connection before INIT");
        }
        ChannelMessage message = WireCodec.decode(line);
        if (message.type() != MessageType.INIT || message.workerName() == null || message.spec() == null) {
            throw new IOException("Expected INIT message but received " + message.type());
        }
        return message;
    }

    private void startReceiver() {
        Thread receiver = new Thread(this::receive, "multiprocess-endpoint-" + workerName());
        receiver.setDaemon(true);
        receiver.start();
    }

    private void receive() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                ChannelMessage message = WireCodec.decode(line);
                switch (message.type()) {
                    case SHARED_OPTIONS -> sharedOptions.offer(message.optionsOrEmpty());
                    case RUN -> runSignal.countDown();
                    default -> log.warn("Unexpected {} message from coordinator", message.type());
                }
            }
        } catch (IOException | OrchestrationException e) {
            if (!closing) {
                log.debug("Coordinator connection ended: {}", e.getMessage());
            }
        } finally {
            disconnected.countDown();
            if (!closing) {
                onDisconnect.run();
            }
        }
    }

    private void write(ChannelMessage message) {
        String line = WireCodec.encode(message);
        synchronized (writeLock) {
            try {
                writer.write(line);
                writer.newLine();
                writer.flush();
            } catch (IOException e) {
                throw new OrchestrationException(workerName(), "Failed to send " + message.type() + " to coordinator", e);
            }
        }
    }

    private Options poll(BlockingQueue<Options> queue) {
        try {
            return queue.poll(POLL_SLICE_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestrationException(workerName(), "Interrupted while waiting for shared options", e);
        }
    }

    private OrchestrationException connectionLost() {
        return new OrchestrationException(workerName(), "Coordinator connection lost");
    }
}
