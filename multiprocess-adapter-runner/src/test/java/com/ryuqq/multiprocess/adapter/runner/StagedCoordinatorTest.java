package com.ryuqq.multiprocess.adapter.runner;

import com.ryuqq.multiprocess.application.coordinator.OptionsSeed;
import com.ryuqq.multiprocess.core.capsule.FailureCapsule;
import com.ryuqq.multiprocess.core.error.ChannelTimeoutException;
import com.ryuqq.multiprocess.core.error.OrchestrationException;
import com.ryuqq.multiprocess.core.error.RemoteWorkerException;
import com.ryuqq.multiprocess.core.error.RuntimeTimeoutException;
import com.ryuqq.multiprocess.core.model.Options;
import com.ryuqq.multiprocess.core.model.RunBudget;
import com.ryuqq.multiprocess.core.spi.Channel;
import com.ryuqq.multiprocess.core.spi.ChannelFactory;
import com.ryuqq.multiprocess.core.spi.ChannelSlot;
import com.ryuqq.multiprocess.core.worker.WorkerSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * StagedCoordinator 유닛 테스트 (Mock Channel).
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>단계 순서: 기여 수집 → 공유 옵션 전송 → 준비 배리어 → 실행 신호 → 공동 대기</li>
 *   <li>초기 옵션은 run당 한 번만 시드</li>
 *   <li>워커 실패 캡슐의 재구성 및 우선순위</li>
 *   <li>조기 종료, 제한 없는 준비 배리어, 전체 실행 타임아웃</li>
 *   <li>모든 경로에서 모든 Channel terminate</li>
 *   <li>백그라운드 워커</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class StagedCoordinatorTest {

    private static final CoordinatorConfig FAST_CONFIG = new CoordinatorConfig(new RunBudget(1000, 0), 10, 10);

    @Mock
    private ChannelFactory channelFactory;

    private final WorkerSpec specA = WorkerSpec.of("a", () -> null);
    private final WorkerSpec specB = WorkerSpec.of("b", () -> null);

    // ============================================================
    // 1. 정상 흐름
    // ============================================================

    @Test
    void run_정상_흐름이면_단계_순서대로_진행되고_모두_terminate() throws Exception {
        // given
        Channel a = openedChannel(specA, Options.of("x", 1, "a", 1));
        Channel b = openedChannel(specB, Options.of("x", 2));

        // when
        coordinator(List.of(specA, specB), OptionsSeed.empty(), FAST_CONFIG).run();

        // then
        Options expectedShared = Options.of("x", 2, "a", 1);
        InOrder inOrder = inOrder(a, b);
        inOrder.verify(a).receiveContribution();
        inOrder.verify(b).receiveContribution();
        inOrder.verify(a).sendSharedOptions(expectedShared);
        inOrder.verify(b).sendSharedOptions(expectedShared);
        inOrder.verify(a).probeReady(anyLong());
        inOrder.verify(b).probeReady(anyLong());
        inOrder.verify(a).sendRunSignal();
        inOrder.verify(b).sendRunSignal();
        inOrder.verify(a).awaitExit(anyLong());
        inOrder.verify(b).awaitExit(anyLong());
        inOrder.verify(a).terminate();
        inOrder.verify(b).terminate();
    }

    @Test
    void run_초기_옵션은_한_번만_시드되어_모든_워커에_전달됨() throws Exception {
        // given
        AtomicInteger seedCalls = new AtomicInteger();
        Options initial = Options.of("x", 0);
        OptionsSeed seed = () -> {
            seedCalls.incrementAndGet();
            return initial;
        };
        openedChannel(specA, Options.empty());
        openedChannel(specB, Options.empty());

        // when
        coordinator(List.of(specA, specB), seed, FAST_CONFIG).run();

        // then
        assertThat(seedCalls).hasValue(1);
        verify(channelFactory).open(specA, initial, FAST_CONFIG.budget());
        verify(channelFactory).open(specB, initial, FAST_CONFIG.budget());
    }

    @Test
    void run_시드가_실패하면_워커를_띄우지_않고_그대로_전파() {
        // given
        OptionsSeed seed = () -> {
            throw new IOException("seed failed");
        };

        // when & then
        assertThatThrownBy(() -> coordinator(List.of(specA), seed, FAST_CONFIG).run())
            .isInstanceOf(IOException.class)
            .hasMessage("seed failed");
        verifyNoInteractions(channelFactory);
    }

    @Test
    void run_릴리스_후_종료_코드_0은_정상_완료() throws Exception {
        // given
        Channel a = openedChannel(specA, Options.empty());
        // 수집, 전송, 준비 확인까지는 살아있고 실행 신호 이후 종료
        when(a.isAlive()).thenReturn(true, true, true, false);
        when(a.exitCode()).thenReturn(OptionalInt.of(0));

        // when
        coordinator(List.of(specA), OptionsSeed.empty(), FAST_CONFIG).run();

        // then
        verify(a).sendRunSignal();
        verify(a).terminate();
    }

    // ============================================================
    // 2. 워커 실패 전파
    // ============================================================

    @Test
    void run_기여_전에_실패한_워커의_캡슐이_원래_타입으로_전파() {
        // given
        Channel a = openedChannel(specA, Options.empty());
        Channel b = openedChannel(specB, Options.empty());
        when(a.receiveContribution()).thenThrow(OrchestrationException.diedPrematurely("a"));
        when(a.pollFailure()).thenReturn(Optional.of(FailureCapsule.capture(new IllegalArgumentException("boom"))));

        // when
        Throwable thrown = catchThrowable(() -> coordinator(List.of(specA, specB), OptionsSeed.empty(), FAST_CONFIG).run());

        // then
        assertThat(thrown)
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("boom");
        assertThat(thrown.getSuppressed()).singleElement().isInstanceOf(OrchestrationException.class);
        verify(b, never()).receiveContribution();
        verify(a).terminate();
        verify(b).terminate();
    }

    @Test
    void run_다른_워커의_캡슐이_채널_타임아웃보다_우선() {
        // given
        Channel a = openedChannel(specA, Options.empty());
        Channel b = openedChannel(specB, Options.empty());
        when(a.receiveContribution()).thenThrow(new ChannelTimeoutException("a", ChannelSlot.CONTRIBUTION, 1000));
        when(b.pollFailure()).thenReturn(Optional.of(FailureCapsule.capture(new IllegalStateException("b broke"))));

        // when
        Throwable thrown = catchThrowable(() -> coordinator(List.of(specA, specB), OptionsSeed.empty(), FAST_CONFIG).run());

        // then
        assertThat(thrown)
            .isExactlyInstanceOf(IllegalStateException.class)
            .hasMessage("b broke");
        assertThat(thrown.getSuppressed()).singleElement().isInstanceOf(ChannelTimeoutException.class);
    }

    @Test
    void run_실행_중_보고된_checked_예외는_그대로_전파() {
        // given
        Channel a = openedChannel(specA, Options.empty());
        when(a.pollFailure()).thenReturn(
            Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(),
            Optional.of(FailureCapsule.capture(new IOException("disk full"))));

        // when & then
        assertThatThrownBy(() -> coordinator(List.of(specA), OptionsSeed.empty(), FAST_CONFIG).run())
            .isExactlyInstanceOf(IOException.class)
            .hasMessage("disk full");
        verify(a).sendRunSignal();
        verify(a).terminate();
    }

    @Test
    void run_AssertionError는_Error_그대로_전파() {
        // given
        Channel a = openedChannel(specA, Options.empty());
        when(a.pollFailure()).thenReturn(Optional.of(FailureCapsule.capture(new AssertionError("expected 1"))));

        // when & then
        assertThatThrownBy(() -> coordinator(List.of(specA), OptionsSeed.empty(), FAST_CONFIG).run())
            .isExactlyInstanceOf(AssertionError.class)
            .hasMessage("expected 1");
        verify(a).terminate();
    }

    @Test
    void run_재구성할_수_없는_종류면_RemoteWorkerException() {
        // given
        Channel a = openedChannel(specA, Options.empty());
        FailureCapsule unknown = new FailureCapsule("com.example.WorkerOnlyException", "remote only", List.of(), null);
        when(a.pollFailure()).thenReturn(Optional.of(unknown));

        // when & then
        assertThatThrownBy(() -> coordinator(List.of(specA), OptionsSeed.empty(), FAST_CONFIG).run())
            .isInstanceOf(RemoteWorkerException.class)
            .hasMessage("com.example.WorkerOnlyException: remote only");
    }

    // ============================================================
    // 3. 조기 종료 및 타임아웃
    // ============================================================

    @Test
    void run_보고_없이_죽은_워커는_diedPrematurely() {
        // given
        Channel a = openedChannel(specA, Options.empty());
        Channel b = openedChannel(specB, Options.empty());
        when(b.isAlive()).thenReturn(false);
        when(b.exitCode()).thenReturn(OptionalInt.of(137));

        // when & then
        assertThatThrownBy(() -> coordinator(List.of(specA, specB), OptionsSeed.empty(), FAST_CONFIG).run())
            .isInstanceOf(OrchestrationException.class)
            .hasMessage("Worker \"b\" has died prematurely");
        verify(a, never()).sendSharedOptions(any());
        verify(a).terminate();
        verify(b).terminate();
    }

    @Test
    void run_릴리스_전_종료_코드_0도_조기_종료() {
        // given
        Channel a = openedChannel(specA, Options.empty());
        when(a.isAlive()).thenReturn(false);
        when(a.exitCode()).thenReturn(OptionalInt.of(0));

        // when & then
        assertThatThrownBy(() -> coordinator(List.of(specA), OptionsSeed.empty(), FAST_CONFIG).run())
            .isInstanceOf(OrchestrationException.class)
            .hasMessageContaining("died prematurely");
    }

    @Test
    void run_준비_배리어는_작업당_타임아웃을_넘겨도_모두_준비될_때까지_대기() throws Exception {
        // given
        CoordinatorConfig config = new CoordinatorConfig(new RunBudget(50, 0), 10, 10);
        Channel a = openedChannel(specA, Options.empty());
        Channel b = openedChannel(specB, Options.empty());
        long readyAtNanos = System.nanoTime() + 300_000_000L;
        when(b.probeReady(anyLong())).thenAnswer(invocation -> sleepThenReturn(System.nanoTime() >= readyAtNanos));

        // when
        coordinator(List.of(specA, specB), OptionsSeed.empty(), config).run();

        // then
        assertThat(System.nanoTime()).isGreaterThanOrEqualTo(readyAtNanos);
        verify(b, atLeast(5)).probeReady(anyLong());
        verify(a).sendRunSignal();
        verify(b).sendRunSignal();
    }

    @Test
    void run_준비_전에_죽은_워커는_배리어에서_조기_종료로_보고() {
        // given
        openedChannel(specA, Options.empty());
        Channel b = openedChannel(specB, Options.empty());
        AtomicInteger probes = new AtomicInteger();
        when(b.probeReady(anyLong())).thenAnswer(invocation -> {
            probes.incrementAndGet();
            return sleepThenReturn(false);
        });
        when(b.isAlive()).thenAnswer(invocation -> probes.get() < 3);
        when(b.exitCode()).thenReturn(OptionalInt.of(1));

        // when & then
        assertThatThrownBy(() -> coordinator(List.of(specA, specB), OptionsSeed.empty(), FAST_CONFIG).run())
            .isInstanceOf(OrchestrationException.class)
            .hasMessageContaining("died prematurely");
        verify(b, never()).sendRunSignal();
        verify(b).terminate();
    }

    @Test
    void run_전체_실행_시간을_넘으면_RuntimeTimeoutException() {
        // given
        CoordinatorConfig config = new CoordinatorConfig(new RunBudget(1000, 150), 10, 10);
        Channel a = openedChannel(specA, Options.empty());
        when(a.awaitExit(anyLong())).thenAnswer(invocation -> sleepThenReturn(false));
        long start = System.nanoTime();

        // when & then
        assertThatThrownBy(() -> coordinator(List.of(specA), OptionsSeed.empty(), config).run())
            .isInstanceOf(RuntimeTimeoutException.class);
        assertThat((System.nanoTime() - start) / 1_000_000L).isGreaterThanOrEqualTo(150);
        verify(a).terminate();
    }

    @Test
    void run_두_번째_워커를_띄우지_못하면_첫_워커도_terminate() {
        // given
        Channel a = openedChannel(specA, Options.empty());
        when(channelFactory.open(eq(specB), any(), any()))
            .thenThrow(new OrchestrationException("b", "Failed to start worker \"b\""));

        // when & then
        assertThatThrownBy(() -> coordinator(List.of(specA, specB), OptionsSeed.empty(), FAST_CONFIG).run())
            .isInstanceOf(OrchestrationException.class)
            .hasMessageContaining("Failed to start");
        verify(a, never()).receiveContribution();
        verify(a).terminate();
    }

    @Test
    void run_terminate가_실패해도_나머지_워커는_terminate() throws Exception {
        // given
        Channel a = openedChannel(specA, Options.empty());
        Channel b = openedChannel(specB, Options.empty());
        doThrow(new IllegalStateException("cannot kill")).when(a).terminate();

        // when
        coordinator(List.of(specA, specB), OptionsSeed.empty(), FAST_CONFIG).run();

        // then
        verify(b).terminate();
    }

    // ============================================================
    // 4. 백그라운드 워커
    // ============================================================

    @Test
    void run_백그라운드_워커는_공동_대기에서_기다리지_않음() throws Exception {
        // given
        WorkerSpec server = WorkerSpec.of("server", () -> null).asBackground();
        Channel background = openedChannel(server, Options.of("port", 9000));
        when(background.isBackground()).thenReturn(true);
        when(background.awaitExit(anyLong())).thenAnswer(invocation -> sleepThenReturn(false));
        Channel client = openedChannel(specA, Options.empty());

        // when
        coordinator(List.of(server, specA), OptionsSeed.empty(), FAST_CONFIG).run();

        // then
        verify(background).sendRunSignal();
        verify(background, never()).awaitExit(anyLong());
        verify(client).awaitExit(anyLong());
        verify(background).terminate();
    }

    @Test
    void run_모두_백그라운드면_모두_기다림() throws Exception {
        // given
        WorkerSpec first = specA.asBackground();
        WorkerSpec second = specB.asBackground();
        Channel a = openedChannel(first, Options.empty());
        Channel b = openedChannel(second, Options.empty());
        when(a.isBackground()).thenReturn(true);
        when(b.isBackground()).thenReturn(true);

        // when
        coordinator(List.of(first, second), OptionsSeed.empty(), FAST_CONFIG).run();

        // then
        verify(a).awaitExit(anyLong());
        verify(b).awaitExit(anyLong());
    }

    // ============================================================
    // 5. 생성자 검증
    // ============================================================

    @Test
    void 생성자_워커가_비어있으면_예외() {
        assertThatThrownBy(() -> coordinator(List.of(), OptionsSeed.empty(), FAST_CONFIG))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("workers");
    }

    @Test
    void 생성자_불변_List로_생성하고_실행() throws Exception {
        // given
        Channel a = openedChannel(specA, Options.empty());

        // when
        coordinator(List.of(specA), OptionsSeed.empty(), FAST_CONFIG).run();
        coordinator(List.copyOf(List.of(specA)), OptionsSeed.empty(), FAST_CONFIG).run();

        // then
        verify(a, times(2)).sendRunSignal();
    }

    @Test
    void 생성자_워커에_null이_있으면_예외() {
        assertThatThrownBy(() -> coordinator(Arrays.asList(specA, null), OptionsSeed.empty(), FAST_CONFIG))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("workers cannot contain null");
    }

    @Test
    void 생성자_config가_null이면_예외() {
        assertThatThrownBy(() -> coordinator(List.of(specA), OptionsSeed.empty(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("config cannot be null");
    }

    // ============================================================
    // Helpers
    // ============================================================

    private StagedCoordinator coordinator(List<WorkerSpec> workers, OptionsSeed seed, CoordinatorConfig config) {
        return new StagedCoordinator(workers, seed, channelFactory, config);
    }

    private static boolean sleepThenReturn(boolean value) throws InterruptedException {
        Thread.sleep(10);
        return value;
    }

    /**
     * 정상 동작하는 Channel mock 생성 (살아있음, 즉시 준비, 즉시 종료).
     */
    private Channel openedChannel(WorkerSpec spec, Options contribution) {
        Channel channel = mock(Channel.class);
        when(channel.workerName()).thenReturn(spec.name());
        when(channel.isAlive()).thenReturn(true);
        when(channel.receiveContribution()).thenReturn(contribution);
        when(channel.probeReady(anyLong())).thenReturn(true);
        when(channel.awaitExit(anyLong())).thenReturn(true);
        when(channel.pollFailure()).thenReturn(Optional.empty());
        when(channelFactory.open(eq(spec), any(), any())).thenReturn(channel);
        return channel;
    }
}
