/**
 * Batch generation value types.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.imagebatch.core.model.BatchItem} - One immutable generation request</li>
 *   <li>{@link com.ryuqq.imagebatch.core.model.OutputTarget} - Where the generated image is written</li>
 *   <li>{@link com.ryuqq.imagebatch.core.model.ImageConfig} - Opaque generation settings passed to the generator</li>
 *   <li>{@link com.ryuqq.imagebatch.core.model.ImageResult} - Successful generation result</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ImageBatch Team
 */
package com.ryuqq.imagebatch.core.model;
