package ru.oparin.calendar.exception;

import org.springframework.http.HttpStatus;

public class NotParticipantException extends CalendarException {

    public NotParticipantException(Long appointmentId) {
        super(HttpStatus.FORBIDDEN, "Вы не являетесь участником встречи #" + appointmentId);
    }
}
