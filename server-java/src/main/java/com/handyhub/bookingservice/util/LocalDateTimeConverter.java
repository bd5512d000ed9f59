package com.handyhub.bookingservice.util;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Stores timestamps as fixed-width {@code yyyy-MM-dd HH:mm:ss} text so that SQLite range
 * predicates compare them in chronological order. Sub-second precision is dropped.
 */
@Converter(autoApply = true)
public class LocalDateTimeConverter implements AttributeConverter<LocalDateTime, String> {

    private static final Logger logger = LoggerFactory.getLogger(LocalDateTimeConverter.class);
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Override
    public String convertToDatabaseColumn(LocalDateTime localDateTime) {
        if (localDateTime == null) {
            return null;
        }
        return localDateTime.format(FORMATTER);
    }

    @Override
    public LocalDateTime convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.trim().isEmpty()) {
            return null;
        }
        try {
            return LocalDateTime.parse(dbData, FORMATTER);
        } catch (DateTimeParseException e) {
            // rows written by hand or by older tooling may carry the ISO 'T' separator
            try {
                return LocalDateTime.parse(dbData.trim().replace(' ', 'T'));
            } catch (DateTimeParseException e2) {
                logger.error("[LocalDateTimeConverter] Unreadable timestamp column value: {}", dbData);
                throw new IllegalStateException("Unreadable timestamp: " + dbData, e2);
            }
        }
    }
}
