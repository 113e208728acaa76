package com.pulsesentinel.core.alert;

import com.pulsesentinel.core.model.Alert;

/**
 * Observes alert lifecycle changes. Callbacks run on the thread that made the
 * change, after the store lock has been released.
 */
public interface AlertListener {

    default void onTriggered(Alert alert) {
    }

    default void onAcknowledged(Alert alert) {
    }

    default void onResolved(Alert alert) {
    }
}
