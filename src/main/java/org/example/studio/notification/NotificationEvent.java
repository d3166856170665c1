package org.example.studio.notification;

public enum NotificationEvent {
    CHARACTER_GENERATION_COMPLETE,
    PAGE_GENERATION_COMPLETE,
    SENT_TO_CUSTOMER,
    CUSTOMER_FEEDBACK_SUBMITTED,
    CUSTOMER_FOLLOW_UP,
    CUSTOMER_ACCEPTED_REPLY,
    CUSTOMER_APPROVED,
    ADMIN_REPLIED
}
