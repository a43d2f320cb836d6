package com.phillippitts.autorecovery.service.notification;

import com.phillippitts.autorecovery.domain.RecoveryExecution;
import com.phillippitts.autorecovery.domain.RecoveryNotification;
import com.phillippitts.autorecovery.domain.RecoveryNotification.Phase;
import com.phillippitts.autorecovery.domain.RecoveryNotification.Severity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Fans recovery start/completion/failure out to every {@link UserNotifier}.
 *
 * <p>Executions whose plan has no user impact are not announced.
 */
@Component
public class RecoveryNotifier {

    private static final Logger LOG = LogManager.getLogger(RecoveryNotifier.class);

    private final List<UserNotifier> notifiers;
    private final Clock clock;

    public RecoveryNotifier(List<UserNotifier> notifiers, Clock clock) {
        this.notifiers = List.copyOf(notifiers);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void started(RecoveryExecution execution) {
        send(execution, Phase.STARTED, Severity.WARNING, "Service recovery in progress: " + execution.getServiceName());
    }

    public void completed(RecoveryExecution execution) {
        send(execution, Phase.COMPLETED, Severity.SUCCESS, "Service recovery completed: " + execution.getServiceName());
    }

    public void failed(RecoveryExecution execution) {
        send(execution, Phase.FAILED, Severity.ERROR, "Service recovery failed: " + execution.getServiceName());
    }

    private void send(RecoveryExecution execution, Phase phase, Severity severity, String message) {
        if (!execution.isUserNotifications()) {
            return;
        }
        RecoveryNotification notification = new RecoveryNotification(
                execution.getServiceName(), message, severity, phase, execution.getId(), clock.instant());
        for (UserNotifier notifier : notifiers) {
            try {
                notifier.send(notification);
            } catch (RuntimeException e) {
                LOG.warn("User notifier {} failed for execution {}: {}",
                        notifier.getClass().getSimpleName(), execution.getId(), e.toString());
            }
        }
    }
}
