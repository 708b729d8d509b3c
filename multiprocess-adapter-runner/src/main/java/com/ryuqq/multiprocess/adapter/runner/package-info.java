/**
 * 단계별 프로토콜 Coordinator 구현.
 *
 * <p>{@link com.ryuqq.multiprocess.adapter.runner.StagedCoordinator}는 SPI
 * {@link com.ryuqq.multiprocess.core.spi.ChannelFactory}에만 의존하므로,
 * 실제 프로세스 구현(adapter-process) 없이 Mock Channel로 테스트할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.multiprocess.adapter.runner;
