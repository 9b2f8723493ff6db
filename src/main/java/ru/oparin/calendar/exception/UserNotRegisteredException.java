package ru.oparin.calendar.exception;

import org.springframework.http.HttpStatus;

public class UserNotRegisteredException extends CalendarException {

    public UserNotRegisteredException(Long tgId) {
        super(HttpStatus.FORBIDDEN, "Пользователь " + tgId + " не зарегистрирован");
    }
}
