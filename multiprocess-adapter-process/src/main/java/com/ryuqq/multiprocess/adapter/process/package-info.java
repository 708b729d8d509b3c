/**
 * OS 프로세스 기반 Channel 구현.
 *
 * <p>Coordinator 쪽 {@link com.ryuqq.multiprocess.adapter.process.ProcessChannel}과
 * 워커 쪽 {@link com.ryuqq.multiprocess.adapter.process.SocketWorkerEndpoint}가
 * 루프백 소켓 위에서 줄 단위 JSON 메시지를 주고받습니다.
 * 워커 프로세스는 {@link com.ryuqq.multiprocess.adapter.process.WorkerLauncher}로 시작됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.multiprocess.adapter.process;
