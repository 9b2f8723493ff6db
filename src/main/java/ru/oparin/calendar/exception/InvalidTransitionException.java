package ru.oparin.calendar.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import ru.oparin.calendar.model.enums.AppointmentStatus;

/**
 * Переход статуса встречи недопустим из текущего статуса.
 */
@Getter
public class InvalidTransitionException extends CalendarException {

    private final Long appointmentId;
    private final AppointmentStatus currentStatus;

    public InvalidTransitionException(Long appointmentId, AppointmentStatus currentStatus, AppointmentStatus target) {
        super(HttpStatus.CONFLICT, String.format("Встреча #%d уже в статусе %s, переход в %s невозможен",
                appointmentId, currentStatus, target));
        this.appointmentId = appointmentId;
        this.currentStatus = currentStatus;
    }
}
