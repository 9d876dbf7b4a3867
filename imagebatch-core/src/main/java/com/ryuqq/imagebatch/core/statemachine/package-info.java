/**
 * Per-item retry state machine.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.imagebatch.core.statemachine.ItemState} - Item lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.imagebatch.core.statemachine.StateTransition} - Transition validation</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING   → SKIPPED | IN_FLIGHT | FAILED
 * IN_FLIGHT → SUCCESS | BACKOFF | FAILED
 * BACKOFF   → IN_FLIGHT | FAILED
 *
 * Forbidden:
 * - SUCCESS, FAILED, SKIPPED → * (terminal)
 * </pre>
 *
 * @since 1.0.0
 * @author ImageBatch Team
 */
package com.ryuqq.imagebatch.core.statemachine;
