/**
 * 워커 유닛 상태 머신.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.multiprocess.core.statemachine;
