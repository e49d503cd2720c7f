package com.example.commitnotifier.domain.entity;

import com.example.commitnotifier.domain.enums.NotificationInterval;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Persists {@link NotificationInterval} as its hour count
 */
@Converter(autoApply = true)
public class NotificationIntervalConverter implements AttributeConverter<NotificationInterval, Integer> {

    @Override
    public Integer convertToDatabaseColumn(NotificationInterval attribute) {
        return attribute == null ? null : attribute.getHours();
    }

    @Override
    public NotificationInterval convertToEntityAttribute(Integer dbData) {
        return dbData == null ? null : NotificationInterval.fromHours(dbData);
    }
}
