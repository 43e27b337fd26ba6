/**
 * Resilience 실행 진입점과 관리용 조회 모델.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.manager;
