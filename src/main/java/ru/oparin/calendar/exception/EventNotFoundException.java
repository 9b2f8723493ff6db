package ru.oparin.calendar.exception;

import org.springframework.http.HttpStatus;

public class EventNotFoundException extends CalendarException {

    public EventNotFoundException(Long eventId) {
        super(HttpStatus.NOT_FOUND, "Событие #" + eventId + " не найдено");
    }
}
