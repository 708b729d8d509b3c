package com.ryuqq.multiprocess.adapter.runner;

import com.ryuqq.multiprocess.application.coordinator.Coordinator;
import com.ryuqq.multiprocess.application.coordinator.OptionsSeed;
import com.ryuqq.multiprocess.core.capsule.FailureCapsule;
import com.ryuqq.multiprocess.core.error.OrchestrationException;
import com.ryuqq.multiprocess.core.error.RuntimeTimeoutException;
import com.ryuqq.multiprocess.core.model.Options;
import com.ryuqq.multiprocess.core.model.RunBudget;
import com.ryuqq.multiprocess.core.spi.Channel;
import com.ryuqq.multiprocess.core.spi.ChannelFactory;
import com.ryuqq.multiprocess.core.worker.WorkerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 5단계 프로토콜로 워커들을 조정하는 Coordinator 구현체.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>초기 옵션 시드 (run당 1회) 후 모든 워커의 Channel 생성</li>
 *   <li>기여 옵션 수집 (등록 순서)</li>
 *   <li>공유 옵션 병합 및 모든 워커에 전송</li>
 *   <li>준비 배리어: 모든 워커가 준비될 때까지 probeReady 반복 (시간 제한 없음, 매 회차 생존 확인)</li>
 *   <li>실행 신호 전송</li>
 *   <li>공동 대기: 포그라운드 워커가 모두 종료될 때까지 라운드로빈 대기 (runtimeTimeoutMs 제한)</li>
 * </ol>
 *
 * <p>각 단계 뒤에는 모든 워커의 실패 슬롯과 생존 여부를 확인합니다.
 * 실패 캡슐이 있으면 그 캡슐을, 없으면 보고 없이 죽은 워커를 즉시 에러로 올립니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>어느 단계에서 실패하든 run()이 끝나기 전에 열린 모든 Channel이 terminate됩니다.</li>
 *   <li>워커가 보고한 실패가 오케스트레이션 오류(타임아웃, 조기 종료)보다 우선합니다.</li>
 *   <li>재시도는 없습니다. 모든 실패는 치명적입니다.</li>
 * </ul>
 *
 * <p>run()을 여러 번 호출할 수 있으며, 호출마다 새 워커들이 시작됩니다.
 * 동시에 여러 스레드에서 같은 인스턴스의 run()을 호출하는 것은 지원하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StagedCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(StagedCoordinator.class);

    private final List<WorkerSpec> workers;
    private final OptionsSeed seed;
    private final ChannelFactory channelFactory;
    private final CoordinatorConfig config;
    private final FailureRaiser failureRaiser = new FailureRaiser();

    /**
     * 생성자.
     *
     * @param workers 등록 순서의 워커 명세 (1개 이상)
     * @param seed 초기 옵션 시드 함수
     * @param channelFactory 워커 시작 및 Channel 생성
     * @param config Coordinator 설정
     * @throws IllegalArgumentException 인자가 null이거나 workers가 비어있는 경우
     */
    public StagedCoordinator(List<WorkerSpec> workers, OptionsSeed seed, ChannelFactory channelFactory,
                             CoordinatorConfig config) {
        if (workers == null || workers.isEmpty()) {
            throw new IllegalArgumentException("workers cannot be null or empty");
        }
        for (WorkerSpec spec : workers) {
            if (spec == null) {
                throw new IllegalArgumentException("workers cannot contain null");
            }
        }
        if (seed == null) {
            throw new IllegalArgumentException("seed cannot be null");
        }
        if (channelFactory == null) {
            throw new IllegalArgumentException("channelFactory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.workers = List.copyOf(workers);
        this.seed = seed;
        this.channelFactory = channelFactory;
        this.config = config;
    }

    @Override
    public void run() throws Exception {
        Options initialOptions = seedInitialOptions();
        List<Channel> channels = new ArrayList<>(workers.size());
        long startNanos = System.nanoTime();
        log.info("Run started with {} workers", workers.size());

        try {
            openChannels(initialOptions, channels);

            // 1. 기여 옵션 수집 + 병합
            Options sharedOptions = collectContributions(channels);

            // 2. 공유 옵션 전송
            broadcast(channels, sharedOptions);

            // 3. 준비 배리어
            awaitReadiness(channels);

            // 4. 실행 신호
            release(channels);

            // 5. 공동 대기
            jointWait(channels);

            log.info("Run completed in {} ms", elapsedMs(startNanos));
        } catch (WorkerFailureSignal signal) {
            throw failureRaiser.toRaisable(signal.workerName(), signal.capsule(), null);
        } catch (OrchestrationException e) {
            Optional<WorkerFailureSignal> pending = findPendingFailure(channels);
            if (pending.isPresent()) {
                throw failureRaiser.toRaisable(pending.get().workerName(), pending.get().capsule(), e);
            }
            log.warn("Run failed after {} ms: {}", elapsedMs(startNanos), e.getMessage());
            throw e;
        } finally {
            terminateAll(channels);
        }
    }

    private Options seedInitialOptions() throws Exception {
        Options initialOptions = seed.seed();
        return initialOptions == null ? Options.empty() : initialOptions;
    }

    private void openChannels(Options initialOptions, List<Channel> channels) {
        for (WorkerSpec spec : workers) {
            channels.add(channelFactory.open(spec, initialOptions, config.budget()));
            log.debug("Worker {} started", spec.name());
        }
    }

    private Options collectContributions(List<Channel> channels) {
        List<Options> contributions = new ArrayList<>(channels.size());
        for (Channel channel : channels) {
            Options contribution = channel.receiveContribution();
            log.debug("Received contribution from {}: {}", channel.workerName(), contribution.keys());
            contributions.add(contribution);
        }
        checkAllOk(channels, false);
        return SharedOptionsMerger.merge(contributions);
    }

    private void broadcast(List<Channel> channels, Options sharedOptions) {
        for (Channel channel : channels) {
            channel.sendSharedOptions(sharedOptions);
        }
        log.info("Shared options sent to {} workers: {}", channels.size(), sharedOptions.keys());
        checkAllOk(channels, false);
    }

    /**
     * 준비 배리어.
     *
     * <p>준비되지 않은 워커마다 readyProbeMs만큼 기다리고, 매 회차마다 실패 슬롯과 생존 여부를 확인합니다.
     * 모든 워커가 준비될 때까지 시간 제한 없이 반복합니다. 준비 전에 죽거나 실패를 보고한 워커는
     * 다음 회차의 확인에서 에러로 올라갑니다.</p>
     */
    private void awaitReadiness(List<Channel> channels) {
        boolean[] ready = new boolean[channels.size()];

        while (true) {
            boolean allReady = true;
            for (int i = 0; i < channels.size(); i++) {
                if (!ready[i]) {
                    ready[i] = channels.get(i).probeReady(config.readyProbeMs());
                    allReady &= ready[i];
                }
            }
            checkAllOk(channels, false);
            if (allReady) {
                log.info("All {} workers ready", channels.size());
                return;
            }
        }
    }

    private void release(List<Channel> channels) {
        for (Channel channel : channels) {
            channel.sendRunSignal();
        }
        log.info("Run signal sent to {} workers", channels.size());
        checkAllOk(channels, true);
    }

    /**
     * 공동 대기.
     *
     * <p>포그라운드 워커가 하나도 없으면 모든 워커를 기다립니다.
     * 전체 실행 타임아웃은 이 단계가 시작될 때부터 측정합니다.</p>
     */
    private void jointWait(List<Channel> channels) {
        List<Channel> awaited = new ArrayList<>();
        for (Channel channel : channels) {
            if (!channel.isBackground()) {
                awaited.add(channel);
            }
        }
        if (awaited.isEmpty()) {
            awaited.addAll(channels);
        }

        RunBudget budget = config.budget();
        long startNanos = System.nanoTime();
        while (true) {
            if (budget.hasRuntimeLimit() && elapsedMs(startNanos) >= budget.runtimeTimeoutMs()) {
                throw new RuntimeTimeoutException(budget.runtimeTimeoutMs());
            }
            boolean allExited = true;
            for (Channel channel : awaited) {
                if (!channel.awaitExit(config.pollIntervalMs())) {
                    allExited = false;
                }
            }
            checkAllOk(channels, true);
            if (allExited) {
                return;
            }
        }
    }

    /**
     * 모든 워커의 실패 슬롯과 생존 여부 확인.
     *
     * @param released 실행 신호를 보낸 뒤인지 여부 (이후에는 종료 코드 0이 정상 완료)
     * @throws WorkerFailureSignal 실패 캡슐이 보고된 경우 (등록 순서상 첫 번째)
     * @throws OrchestrationException 보고 없이 죽은 워커가 있는 경우
     */
    private void checkAllOk(List<Channel> channels, boolean released) {
        Optional<WorkerFailureSignal> failure = findPendingFailure(channels);
        if (failure.isPresent()) {
            throw failure.get();
        }
        for (Channel channel : channels) {
            if (channel.isAlive()) {
                continue;
            }
            OptionalInt exitCode = channel.exitCode();
            boolean completed = released && exitCode.isPresent() && exitCode.getAsInt() == 0;
            if (!completed) {
                log.warn("Worker {} exited with code {} without reporting a failure",
                    channel.workerName(), exitCode.isPresent() ? exitCode.getAsInt() : "unknown");
                throw OrchestrationException.diedPrematurely(channel.workerName());
            }
        }
    }

    private static Optional<WorkerFailureSignal> findPendingFailure(List<Channel> channels) {
        for (Channel channel : channels) {
            Optional<FailureCapsule> capsule = channel.pollFailure();
            if (capsule.isPresent()) {
                return Optional.of(new WorkerFailureSignal(channel.workerName(), capsule.get()));
            }
        }
        return Optional.empty();
    }

    private void terminateAll(List<Channel> channels) {
        for (Channel channel : channels) {
            try {
                channel.terminate();
            } catch (RuntimeException e) {
                log.warn("Failed to terminate worker {}", channel.workerName(), e);
            }
        }
        log.debug("Terminated {} workers", channels.size());
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
