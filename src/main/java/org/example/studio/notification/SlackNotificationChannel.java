package org.example.studio.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;

/**
 * Posts every workflow event to a Slack incoming webhook for the studio team. With no
 * webhook configured, events are only logged.
 */
@Component
@Order(30)
public class SlackNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(SlackNotificationChannel.class);

    private final String webhookUrl;
    private final long timeoutMillis;
    private final WebClient webClient;

    public SlackNotificationChannel(
            @Value("${notifications.slack.webhook-url:}") String webhookUrl,
            @Value("${notifications.timeout-ms:5000}") long timeoutMillis) {
        this.webhookUrl = webhookUrl == null ? "" : webhookUrl.trim();
        this.timeoutMillis = timeoutMillis;
        this.webClient = WebClient.create();
    }

    @Override
    public String name() {
        return "slack";
    }

    @Override
    public void send(NotificationEvent event, Map<String, Object> payload) {
        String text = formatMessage(event, payload);
        if (webhookUrl.isEmpty()) {
            log.info("Notification (no webhook configured): {}", text);
            return;
        }
        webClient.post()
                .uri(webhookUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("text", text))
                .retrieve()
                .toBodilessEntity()
                .block(Duration.ofMillis(timeoutMillis));
        log.debug("Delivered {} notification to Slack", event);
    }

    /**
     * Customer contact details stay out of the team channel.
     */
    static String formatMessage(NotificationEvent event, Map<String, Object> payload) {
        StringBuilder text = new StringBuilder("[").append(event.name()).append("]");
        new TreeMap<>(payload).forEach((key, value) -> {
            if (!CustomerReviewMessage.CONTACT_KEYS.contains(key)) {
                text.append(' ').append(key).append('=').append(value);
            }
        });
        return text.toString();
    }
}
