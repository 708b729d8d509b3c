package com.ryuqq.multiprocess.adapter.process;

import com.ryuqq.multiprocess.adapter.process.wire.ChannelMessage;
import com.ryuqq.multiprocess.adapter.process.wire.WireCodec;
import com.ryuqq.multiprocess.core.capsule.FailureCapsule;
import com.ryuqq.multiprocess.core.error.ChannelTimeoutException;
import com.ryuqq.multiprocess.core.error.OrchestrationException;
import com.ryuqq.multiprocess.core.model.Options;
import com.ryuqq.multiprocess.core.model.RunBudget;
import com.ryuqq.multiprocess.core.spi.Channel;
import com.ryuqq.multiprocess.core.spi.ChannelSlot;
import com.ryuqq.multiprocess.core.worker.WorkerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 워커 프로세스 하나와 연결된 Coordinator 측 Channel.
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>수신 스레드: 워커의 연결을 받아 INIT을 보낸 뒤, 워커가 보낸 메시지를 슬롯별로 분배</li>
 *   <li>송신 스레드: 송신 1건을 perOperationTimeoutMs 안에 끝내지 못하면 ChannelTimeoutException</li>
 *   <li>출력 스레드: 워커의 stdout/stderr를 한 줄씩 로그로 기록
 *       (로거 이름 {@code com.ryuqq.multiprocess.worker.<워커 이름>})</li>
 * </ul>
 *
 * <p><strong>슬롯:</strong></p>
 * <ul>
 *   <li>기여 옵션: 용량 1 큐</li>
 *   <li>준비 신호: 1회용 래치</li>
 *   <li>실패: 첫 캡슐만 보관, {@link #pollFailure()}로 최대 한 번 소비</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class ProcessChannel implements Channel {

    private static final Logger log = LoggerFactory.getLogger(ProcessChannel.class);
    private static final String WORKER_LOGGER_PREFIX = "com.ryuqq.multiprocess.worker.";
    private static final long POLL_SLICE_MS = 100;
    private static final long TERMINATE_WAIT_MS = 100;
    private static final long OUTPUT_DRAIN_MS = 500;

    private final String workerName;
    private final boolean background;
    private final Options initialOptions;
    private final long timeoutMs;
    private final String encodedFactory;
    private final ServerSocket server;
    private final Process process;
    private final Logger outputLog;

    private final CountDownLatch connected = new CountDownLatch(1);
    private final CountDownLatch inboundClosed = new CountDownLatch(1);
    private final CountDownLatch ready = new CountDownLatch(1);
    private final BlockingQueue<Options> contributions = new ArrayBlockingQueue<>(1);
    private final AtomicReference<FailureCapsule> failure = new AtomicReference<>();
    private final AtomicBoolean failureConsumed = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Object writeLock = new Object();
    private final ExecutorService sender;
    private final Thread receiver;
    private final Thread outputPump;

    private volatile Socket socket;
    private volatile BufferedWriter writer;

    ProcessChannel(WorkerSpec spec, Options initialOptions, RunBudget budget, String encodedFactory,
                   ServerSocket server, Process process) {
        this.workerName = spec.name();
        this.background = spec.background();
        this.initialOptions = initialOptions;
        this.timeoutMs = budget.perOperationTimeoutMs();
        this.encodedFactory = encodedFactory;
        this.server = server;
        this.process = process;
        this.outputLog = LoggerFactory.getLogger(WORKER_LOGGER_PREFIX + workerName);
        this.sender = Executors.newSingleThreadExecutor(runnable -> daemon(runnable, "multiprocess-send-" + workerName));
        this.receiver = daemon(this::receive, "multiprocess-receive-" + workerName);
        this.outputPump = daemon(this::pumpOutput, "multiprocess-output-" + workerName);
    }

    void start() {
        outputPump.start();
        receiver.start();
    }

    @Override
    public String workerName() {
        return workerName;
    }

    @Override
    public boolean isBackground() {
        return background;
    }

    @Override
    public Options receiveContribution() {
        long deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (true) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
            Options contribution = pollContribution(Math.max(0, Math.min(remainingMs, POLL_SLICE_MS)));
            if (contribution != null) {
                return contribution;
            }
            if (failure.get() != null) {
                throw new OrchestrationException(workerName,
                    "Worker \"" + workerName + "\" failed before contributing its options");
            }
            if (inboundClosed.getCount() == 0 || (connected.getCount() > 0 && !process.isAlive())) {
                Options late = contributions.poll();
                if (late != null) {
                    return late;
                }
                throw OrchestrationException.diedPrematurely(workerName);
            }
            if (remainingMs <= 0) {
                throw new ChannelTimeoutException(workerName, ChannelSlot.CONTRIBUTION, timeoutMs);
            }
        }
    }

    @Override
    public void sendSharedOptions(Options sharedOptions) {
        send(ChannelSlot.SHARED_OPTIONS, ChannelMessage.sharedOptions(workerName, sharedOptions));
    }

    @Override
    public boolean probeReady(long intervalMs) {
        try {
            return ready.await(intervalMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void sendRunSignal() {
        send(ChannelSlot.RUN, ChannelMessage.run(workerName));
    }

    @Override
    public Optional<FailureCapsule> pollFailure() {
        if (!process.isAlive() && connected.getCount() == 0) {
            // 종료된 워커가 보낸 메시지가 모두 수신될 때까지 대기
            awaitQuietly(inboundClosed, timeoutMs);
        }
        FailureCapsule capsule = failure.get();
        if (capsule == null || !failureConsumed.compareAndSet(false, true)) {
            return Optional.empty();
        }
        return Optional.of(capsule);
    }

    @Override
    public boolean awaitExit(long waitMs) {
        try {
            return process.waitFor(waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestrationException(workerName, "Interrupted while waiting for worker \"" + workerName + "\"", e);
        }
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public OptionalInt exitCode() {
        return process.isAlive() ? OptionalInt.empty() : OptionalInt.of(process.exitValue());
    }

    @Override
    public void terminate() {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        while (process.isAlive()) {
            process.destroy();
            if (!waitForExit(TERMINATE_WAIT_MS)) {
                log.warn("Worker {} (pid {}) ignored termination request, killing forcibly", workerName, process.pid());
                process.destroyForcibly();
                waitForExit(TERMINATE_WAIT_MS);
            }
        }
        if (closed.compareAndSet(false, true)) {
            sender.shutdownNow();
            closeQuietly(socket);
            closeQuietly(server);
            joinQuietly(outputPump, OUTPUT_DRAIN_MS);
            log.debug("Worker {} terminated with exit code {}", workerName, process.exitValue());
        }
    }

    // ============================================================
    // 송신
    // ============================================================

    private void send(ChannelSlot slot, ChannelMessage message) {
        Future<?> future;
        try {
            future = sender.submit(() -> {
                awaitConnection();
                write(message);
                return null;
            });
        } catch (RejectedExecutionException e) {
            throw new OrchestrationException(workerName, "Channel of worker \"" + workerName + "\" is closed", e);
        }

        try {
            future.get(timeoutMs, TimeUnit.MILLISECONDS);
            log.debug("Sent {} to {}", message.type(), workerName);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ChannelTimeoutException(workerName, slot, timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof OrchestrationException) {
                throw (OrchestrationException) cause;
            }
            throw new OrchestrationException(workerName,
                "Failed to send " + slot + " to worker \"" + workerName + "\"", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new OrchestrationException(workerName, "Interrupted while sending " + slot + " to worker \"" + workerName + "\"", e);
        }
    }

    /**
     * 송신 스레드에서 워커 연결을 기다림.
     *
     * <p>연결 전에 프로세스가 죽거나 수신이 끝나면 즉시 실패합니다.
     * 시간 제한은 송신을 기다리는 쪽이 적용합니다.</p>
     */
    private void awaitConnection() throws InterruptedException {
        while (!connected.await(POLL_SLICE_MS, TimeUnit.MILLISECONDS)) {
            if (inboundClosed.getCount() == 0 || !process.isAlive()) {
                throw OrchestrationException.diedPrematurely(workerName);
            }
        }
    }

    private void write(ChannelMessage message) throws IOException {
        String line = WireCodec.encode(message);
        synchronized (writeLock) {
            writer.write(line);
            writer.newLine();
            writer.flush();
        }
    }

    // ============================================================
    // 수신
    // ============================================================

    private void receive() {
        try (Socket accepted = server.accept()) {
            socket = accepted;
            writer = new BufferedWriter(new OutputStreamWriter(accepted.getOutputStream(), StandardCharsets.UTF_8));
            write(ChannelMessage.init(workerName, initialOptions, encodedFactory));
            connected.countDown();
            log.debug("Worker {} connected", workerName);

            BufferedReader reader = new BufferedReader(
                new InputStreamReader(accepted.getInputStream(), StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null) {
                dispatch(WireCodec.decode(line));
            }
        } catch (IOException e) {
            if (!closed.get()) {
                log.debug("Connection of worker {} ended: {}", workerName, e.getMessage());
            }
        } catch (OrchestrationException e) {
            log.error("Dropping connection of worker {}: {}", workerName, e.getMessage(), e);
        } finally {
            inboundClosed.countDown();
        }
    }

    private void dispatch(ChannelMessage message) {
        log.debug("Received {} from {}", message.type(), workerName);
        switch (message.type()) {
            case CONTRIBUTION -> {
                if (!contributions.offer(message.optionsOrEmpty())) {
                    log.warn("Worker {} contributed more than once, ignoring", workerName);
                }
            }
            case READY -> ready.countDown();
            case FAILURE -> {
                if (message.failure() != null && !failure.compareAndSet(null, message.failure())) {
                    log.warn("Worker {} reported another failure, keeping the first: {}", workerName, message.failure());
                }
            }
            default -> log.warn("Unexpected {} message from worker {}", message.type(), workerName);
        }
    }

    private void pumpOutput() {
        try (BufferedReader output = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = output.readLine()) != null) {
                outputLog.info("{}", line);
            }
        } catch (IOException e) {
            log.debug("Output of worker {} closed: {}", workerName, e.getMessage());
        }
    }

    // ============================================================
    // Helpers
    // ============================================================

    private Options pollContribution(long waitMs) {
        try {
            return contributions.poll(waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestrationException(workerName,
                "Interrupted while waiting for contribution of worker \"" + workerName + "\"", e);
        }
    }

    private boolean waitForExit(long waitMs) {
        try {
            return process.waitFor(waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        }
    }

    private static void awaitQuietly(CountDownLatch latch, long waitMs) {
        try {
            latch.await(waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void joinQuietly(Thread thread, long waitMs) {
        try {
            thread.join(waitMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("Failed to close resource of worker {}", workerName, e);
        }
    }

    private static Thread daemon(Runnable runnable, String name) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }
}
