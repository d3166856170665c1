package org.example.studio.notification;

import java.util.Map;

/**
 * Best-effort outbound notifications. Implementations must not throw; delivery failures are
 * logged and dropped.
 */
public interface NotificationGateway {

    void notify(NotificationEvent event, Map<String, Object> payload);
}
