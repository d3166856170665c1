package org.example.studio.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Texts the customer their review link through an OpenPhone-style messages API. Inactive
 * until an API key and sender number are configured; skipped for projects without a phone.
 */
@Component
@Order(20)
public class SmsNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(SmsNotificationChannel.class);

    private final String apiUrl;
    private final String apiKey;
    private final String fromNumber;
    private final String reviewBaseUrl;
    private final long timeoutMillis;
    private final WebClient webClient;

    public SmsNotificationChannel(
            @Value("${notifications.sms.api-url:https://api.openphone.com/v1/messages}") String apiUrl,
            @Value("${notifications.sms.api-key:}") String apiKey,
            @Value("${notifications.sms.from:}") String fromNumber,
            @Value("${notifications.review-base-url:http://localhost:8080}") String reviewBaseUrl,
            @Value("${notifications.timeout-ms:5000}") long timeoutMillis) {
        this.apiUrl = apiUrl;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.fromNumber = fromNumber == null ? "" : fromNumber.trim();
        this.reviewBaseUrl = reviewBaseUrl;
        this.timeoutMillis = timeoutMillis;
        this.webClient = WebClient.create();
    }

    @Override
    public String name() {
        return "sms";
    }

    @Override
    public void send(NotificationEvent event, Map<String, Object> payload) {
        CustomerReviewMessage message = CustomerReviewMessage.from(event, payload, reviewBaseUrl).orElse(null);
        if (message == null) {
            return;
        }
        if (message.phone() == null) {
            log.info("No customer phone on project {}, skipping SMS", payload.get("projectId"));
            return;
        }
        if (apiKey.isEmpty() || fromNumber.isEmpty()) {
            log.info("SMS is not configured, skipping review text for project {}", payload.get("projectId"));
            return;
        }
        webClient.post()
                .uri(apiUrl)
                .header(HttpHeaders.AUTHORIZATION, apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of(
                        "to", List.of(normalizePhoneNumber(message.phone())),
                        "from", normalizePhoneNumber(fromNumber),
                        "content", message.smsBody()))
                .retrieve()
                .toBodilessEntity()
                .block(Duration.ofMillis(timeoutMillis));
        log.info("Sent review SMS for project {}", payload.get("projectId"));
    }

    /**
     * E.164 form, assuming a US number when no country code is given.
     */
    static String normalizePhoneNumber(String phone) {
        String cleaned = phone.replaceAll("[^\\d+]", "");
        if (cleaned.startsWith("+")) {
            return cleaned;
        }
        if (cleaned.length() == 11 && cleaned.startsWith("1")) {
            return "+" + cleaned;
        }
        return "+1" + cleaned;
    }
}
