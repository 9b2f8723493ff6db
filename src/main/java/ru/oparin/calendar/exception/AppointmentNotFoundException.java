package ru.oparin.calendar.exception;

import org.springframework.http.HttpStatus;

public class AppointmentNotFoundException extends CalendarException {

    public AppointmentNotFoundException(Long appointmentId) {
        super(HttpStatus.NOT_FOUND, "Встреча #" + appointmentId + " не найдена");
    }
}
