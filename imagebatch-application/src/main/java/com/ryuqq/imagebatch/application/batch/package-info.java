/**
 * Application Layer - batch entry contract.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.imagebatch.application.batch.BatchRunner} - Sole public entry point</li>
 *   <li>{@link com.ryuqq.imagebatch.application.batch.BatchConfig} - Immutable run settings</li>
 *   <li>{@link com.ryuqq.imagebatch.application.batch.BatchReport} - Ordered successes and statistics</li>
 *   <li>{@link com.ryuqq.imagebatch.application.batch.BatchCancelledException} - Cancellation by the caller</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <pre>
 * adapter-runner (BatchCoordinator)
 *   ↓ implements
 * application (BatchRunner)
 *   ↓ depends on
 * core (BatchItem, Outcome, limiters, SPIs)
 * </pre>
 *
 * @since 1.0.0
 * @author ImageBatch Team
 */
package com.ryuqq.imagebatch.application.batch;
