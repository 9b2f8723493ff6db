package ru.oparin.calendar.exception;

import org.springframework.http.HttpStatus;

public class UnsupportedExportFormatException extends CalendarException {

    public UnsupportedExportFormatException(String format) {
        super(HttpStatus.BAD_REQUEST, "Неподдерживаемый формат выгрузки: " + format);
    }
}
