package com.phillippitts.autorecovery.service.notification;

import com.phillippitts.autorecovery.domain.RecoveryNotification;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/** Writes notifications to the log. Always present so notifications are never silently lost. */
@Component
class LoggingUserNotifier implements UserNotifier {
    private static final Logger LOG = LogManager.getLogger(LoggingUserNotifier.class);

    @Override
    public void send(RecoveryNotification n) {
        switch (n.severity()) {
            case ERROR -> LOG.error("[notify] {} (service={}, executionId={})", n.message(), n.serviceName(), n.executionId());
            case WARNING -> LOG.warn("[notify] {} (service={}, executionId={})", n.message(), n.serviceName(), n.executionId());
            default -> LOG.info("[notify] {} (service={}, executionId={})", n.message(), n.serviceName(), n.executionId());
        }
    }
}
