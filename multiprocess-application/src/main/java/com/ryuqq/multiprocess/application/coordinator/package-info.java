/**
 * Coordinator 공개 계약.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.multiprocess.application.coordinator;
