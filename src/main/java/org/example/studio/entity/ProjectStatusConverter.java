package org.example.studio.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link ProjectStatus} by its lowercase spelling. Legacy spellings found in old rows
 * are normalized on read and written back canonically on the next update.
 */
@Converter(autoApply = true)
public class ProjectStatusConverter implements AttributeConverter<ProjectStatus, String> {

    @Override
    public String convertToDatabaseColumn(ProjectStatus status) {
        return status == null ? null : status.value();
    }

    @Override
    public ProjectStatus convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return ProjectStatus.DRAFT;
        }
        return ProjectStatus.fromValue(dbData);
    }
}
