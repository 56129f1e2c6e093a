/**
 * Engine facade wiring baselines, detectors, correlator, predictive engine,
 * alert manager and outbound dispatch together.
 *
 * @since 1.0.0
 */
package com.apisentinel.core.engine;
