package com.flagship.number_gateway.notify;

/**
 * Fire-and-forget delivery of user notifications.
 *
 * Implementations must not throw: a failed notification never affects ledger state.
 */
public interface Notifier {

    void notify(String userId, NotificationEvent event);
}
