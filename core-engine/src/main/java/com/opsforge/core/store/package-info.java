/**
 * Storage for learned specialist-selection outcomes.
 *
 * @since 1.0.0
 */
package com.opsforge.core.store;
