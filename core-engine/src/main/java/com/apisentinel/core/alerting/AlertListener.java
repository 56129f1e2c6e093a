package com.apisentinel.core.alerting;

/**
 * Receives alert lifecycle transitions.
 *
 * <p>
 * Called synchronously on the thread that caused the transition, after the
 * alert manager released its locks. Implementations must be fast and must
 * not throw; exceptions are logged and ignored.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlertListener {

    void onTransition(AlertTransition transition);
}
