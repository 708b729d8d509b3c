/**
 * Failure Capsule: 프로세스 경계를 넘는 실패 표현.
 *
 * <p>워커에서 {@link com.ryuqq.multiprocess.core.capsule.FailureCapsule#capture(Throwable)}로 포착하고,
 * Coordinator에서 {@link com.ryuqq.multiprocess.core.capsule.FailureCapsule#reconstruct()}로
 * 원래 종류/메시지/위치 경로를 가진 예외를 다시 만듭니다. 살아있는 스택 프레임은 넘어가지 않고
 * (위치, 줄 번호) 목록만 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.multiprocess.core.capsule;
