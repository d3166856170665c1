package org.example.studio.notification;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The customer-facing "ready for review" message carried by a {@link NotificationEvent#SENT_TO_CUSTOMER}
 * payload.
 */
record CustomerReviewMessage(String bookTitle, String firstName, String email, String phone, String reviewUrl) {

    static final String REVIEW_TOKEN = "reviewToken";
    static final String AUTHOR_EMAIL = "authorEmail";
    static final String AUTHOR_PHONE = "authorPhone";
    static final String AUTHOR_FIRSTNAME = "authorFirstname";

    static final Set<String> CONTACT_KEYS = Set.of(REVIEW_TOKEN, AUTHOR_EMAIL, AUTHOR_PHONE, AUTHOR_FIRSTNAME);

    /**
     * Empty for any other event, or when the payload has no review token.
     */
    static Optional<CustomerReviewMessage> from(NotificationEvent event, Map<String, Object> payload, String baseUrl) {
        if (event != NotificationEvent.SENT_TO_CUSTOMER || payload == null) {
            return Optional.empty();
        }
        String token = text(payload.get(REVIEW_TOKEN));
        if (token == null) {
            return Optional.empty();
        }
        String title = text(payload.get("bookTitle"));
        return Optional.of(new CustomerReviewMessage(
                title == null ? "your book" : title,
                firstName(text(payload.get(AUTHOR_FIRSTNAME))),
                text(payload.get(AUTHOR_EMAIL)),
                text(payload.get(AUTHOR_PHONE)),
                reviewUrl(baseUrl, token, text(payload.get("phase")))));
    }

    static String reviewUrl(String baseUrl, String token, String phase) {
        String base = baseUrl == null ? "" : baseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String tab = "sketches".equals(phase) ? "illustrations" : "characters";
        return base + "/review/" + token + "?tab=" + tab;
    }

    String subject() {
        return "Your project \"" + bookTitle + "\" is ready for review";
    }

    String emailBody() {
        return "Hello " + firstName + ",\n\n"
                + "Your project \"" + bookTitle + "\" is now ready for your review and input.\n"
                + "Please review it and let us know about any changes:\n\n"
                + reviewUrl + "\n\n"
                + "Thank you!\n"
                + "US Illustrations Team\n";
    }

    String smsBody() {
        return "Hi " + firstName + ", your project \"" + bookTitle + "\" is ready for review! "
                + "Check your email (including spam) for the review link: " + reviewUrl + " - US Illustrations";
    }

    private static String firstName(String name) {
        if (name == null) {
            return "there";
        }
        return name.split("\\s+")[0];
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }
}
