package com.phillippitts.autorecovery.service.events;

import com.phillippitts.autorecovery.service.metrics.RecoveryMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Turns recovery events into metrics and one-line audit log entries. */
@Component
class RecoveryEventsListener {
    private static final Logger LOG = LogManager.getLogger(RecoveryEventsListener.class);

    private final RecoveryMetrics metrics;

    RecoveryEventsListener(RecoveryMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onHealthChanged(ServiceHealthChangedEvent e) {
        metrics.recordStatusChange(e.newStatus());
    }

    @EventListener
    void onStarted(RecoveryStartedEvent e) {
        metrics.recordTriggered(e.strategy());
    }

    @EventListener
    void onCompleted(RecoveryCompletedEvent e) {
        metrics.recordCompleted("success", e.duration());
    }

    @EventListener
    void onFailed(RecoveryFailedEvent e) {
        metrics.recordCompleted("failed", null);
        LOG.warn("Recovery failed: service={}, executionId={}, failedStep={}",
                e.serviceName(), e.executionId(), e.failedStep());
    }

    @EventListener
    void onCancelled(RecoveryCancelledEvent e) {
        metrics.recordCompleted("cancelled", null);
    }

    @EventListener
    void onRecovered(ServiceRecoveredEvent e) {
        LOG.info("Service recovered: service={}, strategy={}, recoveryCount={}",
                e.serviceName(), e.recoveryType(), e.recoveryCount());
    }
}
