package ru.oparin.calendar.util;

import io.r2dbc.spi.R2dbcNonTransientResourceException;
import io.r2dbc.spi.R2dbcTransientResourceException;
import lombok.experimental.UtilityClass;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.calendar.exception.StorageUnavailableException;

import java.net.ConnectException;

/**
 * Перевод ошибок недоступности БД в {@link StorageUnavailableException}.
 * Конфликты сериализации ({@link ConcurrencyFailureException}) не переводятся: их обрабатывает повтор транзакции.
 */
@UtilityClass
public class StorageErrors {

    public boolean isUnavailable(Throwable error) {
        if (error instanceof StorageUnavailableException) {
            return false;
        }
        if (error instanceof ConcurrencyFailureException) {
            return false;
        }
        return error instanceof DataAccessResourceFailureException
                || error instanceof TransientDataAccessException
                || error instanceof R2dbcNonTransientResourceException
                || error instanceof R2dbcTransientResourceException
                || error instanceof ConnectException;
    }

    public Throwable translate(Throwable error, String operation) {
        if (isUnavailable(error)) {
            return new StorageUnavailableException("Хранилище недоступно при операции: " + operation, error);
        }
        return error;
    }

    public <T> Mono<T> guard(Mono<T> mono, String operation) {
        return mono.onErrorMap(StorageErrors::isUnavailable, e -> translate(e, operation));
    }

    public <T> Flux<T> guard(Flux<T> flux, String operation) {
        return flux.onErrorMap(StorageErrors::isUnavailable, e -> translate(e, operation));
    }
}
