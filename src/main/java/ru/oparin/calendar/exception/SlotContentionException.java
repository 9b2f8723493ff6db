package ru.oparin.calendar.exception;

import org.springframework.http.HttpStatus;

/**
 * Приглашение не удалось сохранить из-за одновременных транзакций. Занятость слота не подтверждена,
 * запрос можно повторить.
 */
public class SlotContentionException extends CalendarException {

    public SlotContentionException(Long participantId, Throwable cause) {
        super(HttpStatus.CONFLICT,
                String.format("Не удалось сохранить приглашение пользователю %d из-за параллельных изменений", participantId),
                cause);
    }
}
