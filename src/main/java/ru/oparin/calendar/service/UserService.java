package ru.oparin.calendar.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.calendar.exception.UserNotRegisteredException;
import ru.oparin.calendar.model.dto.telegram.TelegramUser;
import ru.oparin.calendar.repository.TgUserRepository;
import ru.oparin.calendar.util.StorageErrors;

/**
 * Реестр пользователей Telegram.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final TgUserRepository tgUserRepository;

    /**
     * Зарегистрировать пользователя или обновить его профиль. Повторный вызов безопасен.
     */
    public Mono<Void> register(TelegramUser user) {
        return StorageErrors.guard(
                        tgUserRepository.upsert(user.getId(), user.getUsername(), user.getFirstName(), user.getLastName()),
                        "регистрация пользователя")
                .doOnSuccess(rows -> log.info("Пользователь {} ({}) зарегистрирован", user.getId(), user.getUsername()))
                .then();
    }

    public Mono<Boolean> isRegistered(Long tgId) {
        return StorageErrors.guard(tgUserRepository.existsById(tgId), "проверка регистрации");
    }

    /**
     * Завершается ошибкой {@link UserNotRegisteredException}, если пользователь не зарегистрирован.
     */
    public Mono<Void> requireRegistered(Long tgId) {
        return isRegistered(tgId)
                .flatMap(registered -> registered
                        ? Mono.<Void>empty()
                        : Mono.error(new UserNotRegisteredException(tgId)));
    }
}
