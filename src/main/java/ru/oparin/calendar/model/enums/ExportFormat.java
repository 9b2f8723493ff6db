package ru.oparin.calendar.model.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Форматы выгрузки событий по экспортной ссылке.
 */
public enum ExportFormat {
    JSON,
    CSV;

    public static Optional<ExportFormat> fromPath(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(format -> format.name().equals(normalized))
                .findFirst();
    }

    public String pathValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
