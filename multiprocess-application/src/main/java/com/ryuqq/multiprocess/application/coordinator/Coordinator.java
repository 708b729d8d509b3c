package com.ryuqq.multiprocess.application.coordinator;

/**
 * 여러 워커 프로세스의 실행 조정자.
 *
 * <p>등록된 워커들을 각자의 프로세스로 띄우고, 단계별 프로토콜로 동기화한 뒤
 * 모두 끝날 때까지 기다립니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Coordinator coordinator = MultiprocessRun.builder()
 *     .worker(WorkerSpec.of(EchoServerWorker.class).asBackground())
 *     .worker(Workers.builder("client").run((initial, shared) -> callEcho(shared)))
 *     .runtimeTimeoutMs(10_000)
 *     .build();
 *
 * coordinator.run(); // 워커 실패는 원래 예외 타입 그대로 다시 던져짐
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Coordinator {

    /**
     * 모든 워커를 실행하고 종료까지 대기.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>초기 옵션 생성 (1회) 후 워커 프로세스 시작</li>
     *   <li>기여 옵션 수집 (등록 순서)</li>
     *   <li>공유 옵션 병합 및 전송 (나중 등록 워커가 이김)</li>
     *   <li>준비 배리어</li>
     *   <li>실행 신호 전송</li>
     *   <li>공동 대기 (전체 실행 타임아웃 적용)</li>
     * </ol>
     *
     * <p>어느 단계에서 실패하든 반환/예외 전파 전에 모든 워커 프로세스가 종료됩니다.</p>
     *
     * @throws Exception 워커가 보고한 실패 (원래 타입으로 재구성)
     * @throws com.ryuqq.multiprocess.core.error.ChannelTimeoutException 채널 송수신 타임아웃
     * @throws com.ryuqq.multiprocess.core.error.RuntimeTimeoutException 전체 실행 타임아웃
     * @throws com.ryuqq.multiprocess.core.error.OrchestrationException 워커가 보고 없이 죽은 경우 등
     */
    void run() throws Exception;
}
