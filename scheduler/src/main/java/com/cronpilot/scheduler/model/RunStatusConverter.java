package com.cronpilot.scheduler.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class RunStatusConverter implements AttributeConverter<RunStatus, String> {

    @Override
    public String convertToDatabaseColumn(RunStatus status) {
        return status == null ? null : status.dbValue();
    }

    @Override
    public RunStatus convertToEntityAttribute(String value) {
        return value == null ? null : RunStatus.fromDbValue(value);
    }
}
