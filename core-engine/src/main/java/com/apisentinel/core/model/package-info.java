/**
 * Domain model of the analysis engine.
 *
 * <p>
 * Inbound {@link com.apisentinel.core.model.MetricSample} records and the
 * engine-owned entities derived from them:
 * </p>
 * <ul>
 * <li>{@link com.apisentinel.core.model.BaselineSnapshot}: immutable copy of a
 * series baseline</li>
 * <li>{@link com.apisentinel.core.model.AnomalyCandidate}: deviation flagged
 * by a detector</li>
 * <li>{@link com.apisentinel.core.model.Incident}: correlated candidates
 * spanning environments</li>
 * <li>{@link com.apisentinel.core.model.Prediction}: forecast of a
 * threshold breach</li>
 * <li>{@link com.apisentinel.core.model.Alert} and
 * {@link com.apisentinel.core.model.NotificationIntent}: alert lifecycle
 * output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.apisentinel.core.model;
