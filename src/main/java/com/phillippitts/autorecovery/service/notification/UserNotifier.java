package com.phillippitts.autorecovery.service.notification;

import com.phillippitts.autorecovery.domain.RecoveryNotification;

/**
 * Delivers user-facing recovery notifications (chat, paging, status page).
 *
 * <p>Every {@code UserNotifier} bean receives every notification. Implementations may throw;
 * the failure is logged and the remaining notifiers still run.
 */
public interface UserNotifier {

    void send(RecoveryNotification notification);
}
