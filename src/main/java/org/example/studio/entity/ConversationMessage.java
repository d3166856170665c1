package org.example.studio.entity;

import java.time.LocalDateTime;

public record ConversationMessage(Author author, String text, LocalDateTime at) {

    public enum Author {
        ADMIN,
        CUSTOMER
    }

    public static ConversationMessage admin(String text, LocalDateTime at) {
        return new ConversationMessage(Author.ADMIN, text, at);
    }

    public static ConversationMessage customer(String text, LocalDateTime at) {
        return new ConversationMessage(Author.CUSTOMER, text, at);
    }
}
