package org.example.studio.notification;

import org.example.studio.config.RequestCorrelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans every workflow event out to the registered channels on the notification executor.
 * A channel that fails is logged and skipped; the rest still deliver.
 */
@Service
public class CompositeNotificationGateway implements NotificationGateway {

    private static final Logger log = LoggerFactory.getLogger(CompositeNotificationGateway.class);

    private final List<NotificationChannel> channels;
    private final boolean enabled;
    private final Executor executor;

    public CompositeNotificationGateway(
            List<NotificationChannel> channels,
            @Value("${notifications.enabled:true}") boolean enabled,
            @Qualifier("notificationExecutor") Executor executor) {
        this.channels = channels == null ? List.of() : List.copyOf(channels);
        this.enabled = enabled;
        this.executor = executor;
    }

    @Override
    public void notify(NotificationEvent event, Map<String, Object> payload) {
        if (!enabled || channels.isEmpty()) {
            return;
        }
        Map<String, Object> snapshot = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        try {
            executor.execute(RequestCorrelation.propagate(() -> deliver(event, snapshot)));
        } catch (RejectedExecutionException e) {
            log.warn("Dropped {} notification: executor rejected it", event);
        }
    }

    void deliver(NotificationEvent event, Map<String, Object> payload) {
        for (NotificationChannel channel : channels) {
            try {
                channel.send(event, payload);
            } catch (Exception e) {
                log.warn("{} channel failed to deliver {} notification: {}", channel.name(), event, e.getMessage());
            }
        }
    }

    List<NotificationChannel> channels() {
        return channels;
    }
}
