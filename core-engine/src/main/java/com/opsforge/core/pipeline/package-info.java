/**
 * Per-incident orchestration of the analytics components.
 *
 * @since 1.0.0
 */
package com.opsforge.core.pipeline;
