package ru.oparin.calendar.exception;

import jakarta.validation.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import reactor.core.publisher.Mono;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleAllExceptions(Exception ex) {
        log.error("Неизвестная ошибка: ", ex);

        return Mono.just(ResponseEntity.internalServerError()
                .body(Map.of(
                        "error", "Внутренняя ошибка сервера",
                        "status", 500
                )));
    }

    @ExceptionHandler(InvalidExportTokenException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleInvalidExportToken(InvalidExportTokenException ex) {
        log.warn("Отклонена экспортная ссылка, причина: {}", ex.getReason());

        return Mono.just(ResponseEntity.status(ex.getStatus())
                .body(Map.of("error", ex.getMessage())));
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleStorageUnavailable(StorageUnavailableException ex) {
        log.error("Хранилище недоступно: {}", ex.getMessage(), ex.getCause());

        return Mono.just(ResponseEntity.status(ex.getStatus())
                .body(Map.of(
                        "error", "Сервис временно недоступен",
                        "status", ex.getStatus().value()
                )));
    }

    @ExceptionHandler(CalendarException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleCalendarException(CalendarException ex) {
        log.warn("Запрос отклонён: {}", ex.getMessage());

        return Mono.just(ResponseEntity.status(ex.getStatus())
                .body(Map.of(
                        "error", ex.getMessage(),
                        "status", ex.getStatus().value()
                )));
    }

    @ExceptionHandler(ValidationException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleValidationException(ValidationException ex) {
        return Mono.just(ResponseEntity.badRequest()
                .body(Map.of(
                        "error", "Ошибка валидации",
                        "status", 400,
                        "details", ex.getMessage()
                )));
    }
}
