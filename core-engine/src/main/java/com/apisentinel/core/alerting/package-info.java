/**
 * Alert lifecycle: deduplication, escalation, resolution and listeners.
 *
 * @since 1.0.0
 */
package com.apisentinel.core.alerting;
