/**
 * Service Provider Interface 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.multiprocess.core.spi.Channel} - Coordinator 측 워커 핸들</li>
 *   <li>{@link com.ryuqq.multiprocess.core.spi.ChannelFactory} - 워커 시작 + Channel 생성</li>
 *   <li>{@link com.ryuqq.multiprocess.core.spi.WorkerEndpoint} - 워커 측 채널</li>
 * </ul>
 *
 * <p>구현체는 adapter 모듈에 있습니다 (예: multiprocess-adapter-process).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.multiprocess.core.spi;
