package org.example.studio.entity;

import jakarta.persistence.Converter;

@Converter
public class FeedbackHistoryJsonConverter extends JsonListConverter<FeedbackHistoryEntry> {

    public FeedbackHistoryJsonConverter() {
        super(FeedbackHistoryEntry.class);
    }
}
