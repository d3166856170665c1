package org.example.studio.notification;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompositeNotificationGatewayTest {

    @Mock
    private NotificationChannel email;

    @Mock
    private NotificationChannel sms;

    @Test
    void notify_whenDisabled_queuesNothing() {
        List<Runnable> queued = new ArrayList<>();
        CompositeNotificationGateway gateway = new CompositeNotificationGateway(List.of(email, sms), false, queued::add);

        gateway.notify(NotificationEvent.SENT_TO_CUSTOMER, Map.of("projectId", "p-1"));

        assertTrue(queued.isEmpty());
        verifyNoInteractions(email, sms);
    }

    @Test
    void notify_deliversPayloadSnapshotOnExecutor() {
        List<Runnable> queued = new ArrayList<>();
        CompositeNotificationGateway gateway = new CompositeNotificationGateway(List.of(email), true, queued::add);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("projectId", "p-1");

        gateway.notify(NotificationEvent.SENT_TO_CUSTOMER, payload);
        payload.clear();

        verifyNoInteractions(email);
        assertEquals(1, queued.size());
        queued.get(0).run();
        verify(email).send(NotificationEvent.SENT_TO_CUSTOMER, Map.of("projectId", "p-1"));
    }

    @Test
    void deliver_failingChannel_doesNotStopTheOthers() {
        when(email.name()).thenReturn("email");
        doThrow(new IllegalStateException("smtp down")).when(email).send(any(), any());
        CompositeNotificationGateway gateway = new CompositeNotificationGateway(List.of(email, sms), true, Runnable::run);

        assertDoesNotThrow(() -> gateway.notify(NotificationEvent.CUSTOMER_APPROVED, Map.of("projectId", "p-1")));

        verify(sms).send(eq(NotificationEvent.CUSTOMER_APPROVED), any());
    }

    @Test
    void notify_whenExecutorRejects_doesNotThrow() {
        CompositeNotificationGateway gateway = new CompositeNotificationGateway(List.of(email), true, task -> {
            throw new RejectedExecutionException("full");
        });

        assertDoesNotThrow(() -> gateway.notify(NotificationEvent.ADMIN_REPLIED, Map.of()));
        verifyNoInteractions(email);
    }
}
