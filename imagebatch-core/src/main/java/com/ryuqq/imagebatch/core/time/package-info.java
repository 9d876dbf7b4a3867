/**
 * Time abstractions used by the limiters and the retry loop.
 *
 * @since 1.0.0
 * @author ImageBatch Team
 */
package com.ryuqq.imagebatch.core.time;
