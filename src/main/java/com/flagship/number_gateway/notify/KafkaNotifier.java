package com.flagship.number_gateway.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes notifications to the user-notifications topic, keyed by user id.
 * The push channel to clients consumes that topic.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notifier.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaNotifier implements Notifier {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    @Value("${kafka.topic.notifications:user-notifications}")
    private String notificationsTopic;

    @Override
    public void notify(String userId, NotificationEvent event) {
        try {
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("user_id", userId);
            envelope.put("type", event.getType());
            envelope.put("data", event.getData());
            envelope.put("occurred_at", event.getOccurredAt());
            String payload = objectMapper.writeValueAsString(envelope);

            kafkaTemplate.send(notificationsTopic, userId, payload)
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.warn("Notification not delivered: userId={}, type={}, error={}",
                            userId, event.getType(), error.getMessage());
                    }
                });
        } catch (JsonProcessingException e) {
            log.warn("Notification not serializable: userId={}, type={}", userId, event.getType(), e);
        } catch (RuntimeException e) {
            log.warn("Notification send failed: userId={}, type={}, error={}", userId, event.getType(), e.getMessage());
        }
    }
}
