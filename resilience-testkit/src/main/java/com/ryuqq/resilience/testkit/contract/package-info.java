/**
 * Reusable contract tests for CircuitBreaker and ResilienceManager implementations.
 *
 * <p>Adapter modules extend these classes and supply the implementation under test.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.testkit.contract;
