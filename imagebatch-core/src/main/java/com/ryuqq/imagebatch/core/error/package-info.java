/**
 * Failure taxonomy of the generation boundary.
 *
 * <p>{@link com.ryuqq.imagebatch.core.error.ErrorKind} is an explicit tag set by the collaborator,
 * carried by {@link com.ryuqq.imagebatch.core.error.GenerationException}.</p>
 *
 * @since 1.0.0
 * @author ImageBatch Team
 */
package com.ryuqq.imagebatch.core.error;
