/**
 * Admission control for calls to the generation service.
 *
 * <p>Two independent limiters gate every attempt, always acquired in this order:</p>
 * <ol>
 *   <li>{@link com.ryuqq.imagebatch.core.protection.ConcurrencyLimiter} - Resizable in-flight window
 *       ({@link com.ryuqq.imagebatch.core.protection.AdaptiveConcurrencyLimiter})</li>
 *   <li>{@link com.ryuqq.imagebatch.core.protection.RateLimiter} - Requests-per-minute token bucket
 *       ({@link com.ryuqq.imagebatch.core.protection.TokenBucketLimiter})</li>
 * </ol>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code min ≤ current ≤ max} for the concurrency window</li>
 *   <li>{@code 0 ≤ capacity ≤ maxPerMinute} for the token bucket</li>
 *   <li>No limiter suspends while holding its internal lock</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ImageBatch Team
 */
package com.ryuqq.imagebatch.core.protection;
