/**
 * Cross-environment correlation of anomaly candidates into incidents.
 *
 * @since 1.0.0
 */
package com.apisentinel.core.correlation;
