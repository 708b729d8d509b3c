/**
 * Coordinator와 워커 프로세스 사이의 줄 단위 JSON 프로토콜.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.multiprocess.adapter.process.wire;
