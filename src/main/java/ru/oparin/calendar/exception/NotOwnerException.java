package ru.oparin.calendar.exception;

import org.springframework.http.HttpStatus;

/**
 * Попытка изменить чужое событие. Сообщение не раскрывает содержимое события.
 */
public class NotOwnerException extends CalendarException {

    public NotOwnerException(Long eventId) {
        super(HttpStatus.FORBIDDEN, "Нет доступа к событию #" + eventId);
    }
}
