/**
 * 코어 값 객체 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.multiprocess.core.model.Options} - 워커 간 교환되는 옵션 맵 (InitialOptions, SharedOptions)</li>
 *   <li>{@link com.ryuqq.multiprocess.core.model.RunBudget} - 송수신 1회 타임아웃 + 전체 실행 타임아웃</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> 모든 값 객체는 불변</li>
 *   <li><strong>Validation:</strong> 생성자에서 유효성 검증</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.multiprocess.core.model;
