package com.apisentinel.core.alerting;

import com.apisentinel.core.model.Alert;

/**
 * Mutable holder of the active alert for one dedup key. Guarded by its own
 * monitor; once retired it must not be used again.
 */
final class AlertSlot {

    Alert current;
    int cleanStreak;
    boolean retired;
}
