/**
 * In-memory metrics collector.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.metrics;
