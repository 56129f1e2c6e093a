package com.apisentinel.core.sink;

import com.apisentinel.core.model.NotificationIntent;

/**
 * Hand-off point to the notification transport.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface NotificationSink {

    /**
     * @throws Exception if the intent could not be handed off; the call is
     *                   retried
     */
    void deliver(NotificationIntent intent) throws Exception;

    /** Sink that drops everything. */
    static NotificationSink discarding() {
        return intent -> {
        };
    }
}
