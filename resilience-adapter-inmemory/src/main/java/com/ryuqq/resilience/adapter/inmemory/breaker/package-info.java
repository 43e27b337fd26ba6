/**
 * In-memory Circuit Breaker and per-operation breaker registry.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.breaker;
