package ru.oparin.calendar.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Участник уже занят в указанный слот.
 */
@Getter
public class SlotBusyException extends CalendarException {

    private final Long participantId;
    private final LocalDate date;
    private final LocalTime time;

    public SlotBusyException(Long participantId, LocalDate date, LocalTime time) {
        super(HttpStatus.CONFLICT, String.format("Пользователь %d уже занят %s в %s", participantId, date, time));
        this.participantId = participantId;
        this.date = date;
        this.time = time;
    }
}
