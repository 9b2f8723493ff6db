package ru.oparin.calendar.service.conversation;

import lombok.experimental.UtilityClass;
import ru.oparin.calendar.exception.ConversationInputException;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Set;

/**
 * Разбор пользовательского ввода по типу шага.
 * При ошибке бросает {@link ConversationInputException} с текстом для повторного ввода.
 */
@UtilityClass
public class StepInputParser {

    public static final String SKIP_MARKER = "Пропустить";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final Set<String> SKIP_WORDS = Set.of("пропустить", "skip", "-");
    private static final Set<String> YES_WORDS = Set.of("да", "yes", "public", "публичное");
    private static final Set<String> NO_WORDS = Set.of("нет", "no", "private", "приватное");

    /**
     * Разобрать ввод для шага.
     *
     * @return String для TEXT и OPTIONAL_TEXT, LocalDate, LocalTime, Long или Boolean для остальных типов
     */
    public Object parse(StepInputType type, String raw) {
        String input = raw == null ? "" : raw.trim();
        return switch (type) {
            case TEXT -> parseText(input);
            case DATE -> parseDate(input);
            case TIME -> parseTime(input);
            case POSITIVE_ID -> parsePositiveId(input);
            case OPTIONAL_TEXT -> SKIP_WORDS.contains(input.toLowerCase(Locale.ROOT)) ? "" : input;
            case VISIBILITY -> parseVisibility(input);
        };
    }

    private String parseText(String input) {
        if (input.isEmpty()) {
            throw new ConversationInputException("Значение не может быть пустым. Попробуйте ещё раз:");
        }
        return input;
    }

    private LocalDate parseDate(String input) {
        try {
            return LocalDate.parse(input, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new ConversationInputException("Неверный формат даты. Пример: 2025-11-03. Попробуйте ещё раз:");
        }
    }

    private LocalTime parseTime(String input) {
        try {
            return LocalTime.parse(input, TIME_FORMAT);
        } catch (DateTimeParseException e) {
            throw new ConversationInputException("Неверный формат времени. Пример: 14:30. Попробуйте ещё раз:");
        }
    }

    private Long parsePositiveId(String input) {
        if (!input.matches("\\d{1,18}")) {
            throw new ConversationInputException("ID должен быть положительным числом. Повторите ввод:");
        }
        long id = Long.parseLong(input);
        if (id <= 0) {
            throw new ConversationInputException("ID должен быть положительным числом. Повторите ввод:");
        }
        return id;
    }

    private Boolean parseVisibility(String input) {
        String normalized = input.toLowerCase(Locale.ROOT);
        if (YES_WORDS.contains(normalized)) {
            return Boolean.TRUE;
        }
        if (NO_WORDS.contains(normalized)) {
            return Boolean.FALSE;
        }
        throw new ConversationInputException("Ответьте «да» или «нет»:");
    }
}
