package com.flagship.number_gateway.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Used when Kafka notifications are switched off, e.g. in local runs.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "notifier.kafka.enabled", havingValue = "false")
public class LoggingNotifier implements Notifier {

    @Override
    public void notify(String userId, NotificationEvent event) {
        log.info("Notification: userId={}, type={}, data={}", userId, event.getType(), event.getData());
    }
}
