/**
 * Outbound hand-off: record store and notification sinks behind a retrying
 * asynchronous dispatcher.
 *
 * @since 1.0.0
 */
package com.apisentinel.core.sink;
