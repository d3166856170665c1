package org.example.studio.entity;

import jakarta.persistence.Converter;

@Converter
public class ConversationThreadJsonConverter extends JsonListConverter<ConversationMessage> {

    public ConversationThreadJsonConverter() {
        super(ConversationMessage.class);
    }
}
