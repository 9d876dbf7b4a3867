/**
 * Runner Adapter Layer - BatchRunner 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.imagebatch.adapter.runner.BatchCoordinator} - 항목별 fan-out / fan-in</li>
 *   <li>{@link com.ryuqq.imagebatch.adapter.runner.RetryOrchestrator} - 항목별 재시도 상태 기계</li>
 *   <li>{@link com.ryuqq.imagebatch.adapter.runner.BackoffCalculator} - 지수 backoff</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (BatchCoordinator, RetryOrchestrator)
 *   ↓ implements
 * application (BatchRunner, BatchConfig, RunStats)
 *   ↓ depends on
 * core (BatchItem, Outcome, ItemState, limiters, SPIs)
 * </pre>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
package com.ryuqq.imagebatch.adapter.runner;
