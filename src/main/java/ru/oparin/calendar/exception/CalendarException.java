package ru.oparin.calendar.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Базовое исключение прикладных ошибок календаря.
 * Все наследники восстанавливаемые: процесс продолжает работу, пользователь получает сообщение.
 */
public abstract class CalendarException extends RuntimeException {
    @Getter
    private final HttpStatus status;

    protected CalendarException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected CalendarException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
