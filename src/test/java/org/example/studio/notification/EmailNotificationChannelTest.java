package org.example.studio.notification;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class EmailNotificationChannelTest {

    @Mock
    private JavaMailSender mailSender;

    @Test
    void send_mailsReviewLinkToCustomer() {
        EmailNotificationChannel channel = new EmailNotificationChannel(mailSender, "studio@example.com", "https://studio.example.com/");

        channel.send(NotificationEvent.SENT_TO_CUSTOMER, sentPayload("sketches"));

        ArgumentCaptor<SimpleMailMessage> mail = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(mail.capture());
        assertEquals("studio@example.com", mail.getValue().getFrom());
        assertArrayEquals(new String[] {"maya@example.com"}, mail.getValue().getTo());
        assertEquals("Your project \"The Brave Fox\" is ready for review", mail.getValue().getSubject());
        assertTrue(mail.getValue().getText().startsWith("Hello Maya,"));
        assertTrue(mail.getValue().getText().contains("https://studio.example.com/review/tok-1?tab=illustrations"));
    }

    @Test
    void send_ignoresOtherEventsAndProjectsWithoutEmail() {
        EmailNotificationChannel channel = new EmailNotificationChannel(mailSender, "", "http://localhost:8080");
        Map<String, Object> noEmail = sentPayload("characters");
        noEmail.remove("authorEmail");

        channel.send(NotificationEvent.CUSTOMER_APPROVED, sentPayload("characters"));
        channel.send(NotificationEvent.SENT_TO_CUSTOMER, noEmail);

        verifyNoInteractions(mailSender);
    }

    @Test
    void send_withoutMailSender_skipsQuietly() {
        EmailNotificationChannel channel = new EmailNotificationChannel((JavaMailSender) null, "", "http://localhost:8080");

        assertDoesNotThrow(() -> channel.send(NotificationEvent.SENT_TO_CUSTOMER, sentPayload("characters")));
    }

    static Map<String, Object> sentPayload(String phase) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("projectId", "p-1");
        payload.put("bookTitle", "The Brave Fox");
        payload.put("phase", phase);
        payload.put("round", 1);
        payload.put("reviewToken", "tok-1");
        payload.put("authorFirstname", "Maya Lynn");
        payload.put("authorEmail", "maya@example.com");
        payload.put("authorPhone", "(555) 010-2000");
        return payload;
    }
}
