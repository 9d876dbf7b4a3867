/**
 * Test doubles for the image batch SPIs.
 *
 * <ul>
 *   <li>{@link com.ryuqq.imagebatch.testkit.ManualClock} - time that moves only when told</li>
 *   <li>{@link com.ryuqq.imagebatch.testkit.RecordingSleeper} - records sleeps, optionally advancing a ManualClock</li>
 *   <li>{@link com.ryuqq.imagebatch.testkit.ScriptedImageGenerator} - per-prompt failure scripts</li>
 *   <li>{@link com.ryuqq.imagebatch.testkit.InMemoryOutputStore} - set-backed output existence</li>
 * </ul>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
package com.ryuqq.imagebatch.testkit;
