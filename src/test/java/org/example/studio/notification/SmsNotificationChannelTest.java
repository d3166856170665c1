package org.example.studio.notification;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SmsNotificationChannelTest {

    @Test
    void normalizePhoneNumber_producesE164() {
        assertEquals("+15550102000", SmsNotificationChannel.normalizePhoneNumber("(555) 010-2000"));
        assertEquals("+15550102000", SmsNotificationChannel.normalizePhoneNumber("1-555-010-2000"));
        assertEquals("+447700900123", SmsNotificationChannel.normalizePhoneNumber("+44 7700 900123"));
    }

    @Test
    void smsBody_greetsByFirstNameWithReviewLink() {
        CustomerReviewMessage message = CustomerReviewMessage.from(NotificationEvent.SENT_TO_CUSTOMER,
                EmailNotificationChannelTest.sentPayload("characters"), "https://studio.example.com").orElseThrow();

        assertEquals("Hi Maya, your project \"The Brave Fox\" is ready for review! Check your email (including spam) "
                + "for the review link: https://studio.example.com/review/tok-1?tab=characters - US Illustrations",
                message.smsBody());
    }

    @Test
    void send_withoutApiKey_skipsQuietly() {
        SmsNotificationChannel channel = new SmsNotificationChannel(
                "http://127.0.0.1:1/messages", "", "+15550000000", "http://localhost:8080", 500);

        assertDoesNotThrow(() -> channel.send(NotificationEvent.SENT_TO_CUSTOMER,
                EmailNotificationChannelTest.sentPayload("characters")));
    }

    @Test
    void send_skipsProjectsWithoutPhone() {
        SmsNotificationChannel channel = new SmsNotificationChannel(
                "http://127.0.0.1:1/messages", "key", "+15550000000", "http://localhost:8080", 500);
        Map<String, Object> payload = EmailNotificationChannelTest.sentPayload("characters");
        payload.remove("authorPhone");

        assertDoesNotThrow(() -> channel.send(NotificationEvent.SENT_TO_CUSTOMER, payload));
    }

    @Test
    void send_toUnreachableApi_reportsFailure() {
        SmsNotificationChannel channel = new SmsNotificationChannel(
                "http://127.0.0.1:1/messages", "key", "+15550000000", "http://localhost:8080", 500);

        assertThrows(RuntimeException.class, () -> channel.send(NotificationEvent.SENT_TO_CUSTOMER,
                EmailNotificationChannelTest.sentPayload("characters")));
    }
}
