/**
 * Reusable contract test bases for limiter implementations.
 *
 * <p>Extend {@link com.ryuqq.imagebatch.testkit.contract.AbstractConcurrencyLimiterContractTest} or
 * {@link com.ryuqq.imagebatch.testkit.contract.AbstractRateLimiterContractTest} and supply a factory
 * to verify that an implementation follows the limiter laws.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
package com.ryuqq.imagebatch.testkit.contract;
