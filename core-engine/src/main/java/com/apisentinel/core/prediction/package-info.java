/**
 * Trend-based breach forecasting.
 *
 * @since 1.0.0
 */
package com.apisentinel.core.prediction;
