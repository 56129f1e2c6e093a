/**
 * Anomaly detectors.
 *
 * <p>
 * Each detector judges one sample against the baseline snapshot from before
 * the sample and emits an {@link com.apisentinel.core.model.AnomalyCandidate}
 * with a deviation score on the common (0, 100] scale
 * ({@link com.apisentinel.core.detection.DeviationScores}).
 * </p>
 *
 * @since 1.0.0
 */
package com.apisentinel.core.detection;
