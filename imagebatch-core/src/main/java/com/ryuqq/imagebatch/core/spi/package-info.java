/**
 * Service Provider Interfaces for the collaborators of the batch core.
 *
 * <h2>SPIs</h2>
 * <ul>
 *   <li>{@link com.ryuqq.imagebatch.core.spi.ImageGenerator} - The generation call; classifies its own failures</li>
 *   <li>{@link com.ryuqq.imagebatch.core.spi.OutputStore} - Existence check for skip-existing</li>
 * </ul>
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li><strong>Thread Safety:</strong> Both SPIs are called concurrently from item worker threads</li>
 *   <li><strong>Classification:</strong> ImageGenerator maps transport signals to exactly one ErrorKind</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ImageBatch Team
 */
package com.ryuqq.imagebatch.core.spi;
