package org.example.studio.notification;

import java.util.Map;

/**
 * One outbound delivery route. Channels may throw; {@link CompositeNotificationGateway}
 * isolates each channel's failures from the others.
 */
public interface NotificationChannel {

    String name();

    /**
     * Deliver the event, or return quietly when this channel has nothing to send for it.
     */
    void send(NotificationEvent event, Map<String, Object> payload);
}
