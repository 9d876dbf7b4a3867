/**
 * Batch run statistics.
 *
 * <ul>
 *   <li>{@link com.ryuqq.imagebatch.application.stats.RunStatsCollector} - Atomic counters shared by item workers</li>
 *   <li>{@link com.ryuqq.imagebatch.application.stats.RunStats} - Immutable snapshot returned to callers</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ImageBatch Team
 */
package com.ryuqq.imagebatch.application.stats;
