/**
 * 오류 분류 체계.
 *
 * <pre>
 * RuntimeException
 *   ├─ OrchestrationException      (구조적 실패: 워커 조기 종료, 채널 단절, 생성 실패)
 *   │    ├─ ChannelTimeoutException (송수신 1회 타임아웃, 워커 + 슬롯 귀속)
 *   │    └─ RuntimeTimeoutException (전체 실행 타임아웃)
 *   ├─ CapsuleException            (캡슐 재구성 불가)
 *   └─ RemoteWorkerException       (재구성 불가 시 대체 예외)
 * </pre>
 *
 * <p>워커 애플리케이션 실패(contribute/setup/run에서 발생한 예외)는 원래 타입으로
 * 재구성되어 그대로 던져지며, OrchestrationException보다 우선합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.multiprocess.core.error;
