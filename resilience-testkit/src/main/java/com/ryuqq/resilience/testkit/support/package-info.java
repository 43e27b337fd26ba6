/**
 * Deterministic clock, recording sink and scripted operation for resilience tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.testkit.support;
