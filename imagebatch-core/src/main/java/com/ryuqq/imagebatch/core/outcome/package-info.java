/**
 * Per-item outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for item results.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.imagebatch.core.outcome.Ok} - Generated successfully</li>
 *   <li>{@link com.ryuqq.imagebatch.core.outcome.Retry} - Retryable failure with the backoff to apply</li>
 *   <li>{@link com.ryuqq.imagebatch.core.outcome.Fail} - Non-retryable failure or retries exhausted</li>
 *   <li>{@link com.ryuqq.imagebatch.core.outcome.Skip} - Output already existed</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * if (outcome instanceof Ok ok) {
 *     results.add(ok.result());
 * } else if (outcome instanceof Retry retry) {
 *     sleeper.sleep(retry.nextRetryAfterMillis());
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author ImageBatch Team
 */
package com.ryuqq.imagebatch.core.outcome;
