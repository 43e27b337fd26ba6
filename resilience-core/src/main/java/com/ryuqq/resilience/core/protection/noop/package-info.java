/**
 * Protection SPI의 NoOp 기본 구현.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.protection.noop;
