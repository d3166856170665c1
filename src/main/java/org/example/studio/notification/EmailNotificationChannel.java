package org.example.studio.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Emails the customer their review link when a phase is sent to them. Inactive unless a
 * mail sender is configured ({@code spring.mail.host}).
 */
@Component
@Order(10)
public class EmailNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(EmailNotificationChannel.class);

    private final JavaMailSender mailSender;
    private final String from;
    private final String reviewBaseUrl;

    @Autowired
    public EmailNotificationChannel(
            ObjectProvider<JavaMailSender> mailSender,
            @Value("${notifications.email.from:}") String from,
            @Value("${notifications.review-base-url:http://localhost:8080}") String reviewBaseUrl) {
        this(mailSender.getIfAvailable(), from, reviewBaseUrl);
    }

    EmailNotificationChannel(JavaMailSender mailSender, String from, String reviewBaseUrl) {
        this.mailSender = mailSender;
        this.from = from == null ? "" : from.trim();
        this.reviewBaseUrl = reviewBaseUrl;
    }

    @Override
    public String name() {
        return "email";
    }

    @Override
    public void send(NotificationEvent event, Map<String, Object> payload) {
        CustomerReviewMessage message = CustomerReviewMessage.from(event, payload, reviewBaseUrl).orElse(null);
        if (message == null) {
            return;
        }
        if (message.email() == null) {
            log.info("No customer email on project {}, skipping review email", payload.get("projectId"));
            return;
        }
        if (mailSender == null) {
            log.info("Mail is not configured, skipping review email to {}", message.email());
            return;
        }
        SimpleMailMessage mail = new SimpleMailMessage();
        if (!from.isEmpty()) {
            mail.setFrom(from);
        }
        mail.setTo(message.email());
        mail.setSubject(message.subject());
        mail.setText(message.emailBody());
        mailSender.send(mail);
        log.info("Sent review email for project {}", payload.get("projectId"));
    }
}
