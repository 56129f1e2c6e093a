/**
 * Per-series rolling baselines.
 *
 * @since 1.0.0
 */
package com.apisentinel.core.baseline;
