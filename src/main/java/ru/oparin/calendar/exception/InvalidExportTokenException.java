package ru.oparin.calendar.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Экспортная ссылка недействительна.
 * Поддельная и просроченная ссылки дают одинаковое сообщение, причина доступна только для логов.
 */
public class InvalidExportTokenException extends CalendarException {

    public static final String MESSAGE = "Ссылка недействительна";

    public enum Reason {
        MALFORMED,
        BAD_SIGNATURE,
        EXPIRED
    }

    @Getter
    private final Reason reason;

    public InvalidExportTokenException(Reason reason) {
        super(HttpStatus.FORBIDDEN, MESSAGE);
        this.reason = reason;
    }
}
