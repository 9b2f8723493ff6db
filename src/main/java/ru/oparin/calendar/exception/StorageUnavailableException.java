package ru.oparin.calendar.exception;

import org.springframework.http.HttpStatus;

/**
 * Хранилище недоступно. Вызывающий код может повторить операцию позже.
 */
public class StorageUnavailableException extends CalendarException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
