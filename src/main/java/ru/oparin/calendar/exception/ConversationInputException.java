package ru.oparin.calendar.exception;

import org.springframework.http.HttpStatus;

/**
 * Ввод на шаге диалога не распознан. Диалог остаётся на том же шаге.
 */
public class ConversationInputException extends CalendarException {

    public ConversationInputException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
