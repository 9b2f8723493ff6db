package ru.oparin.calendar.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;
import ru.oparin.calendar.model.entity.TgUser;

/**
 * Репозиторий зарегистрированных пользователей Telegram.
 */
public interface TgUserRepository extends ReactiveCrudRepository<TgUser, Long> {

    /**
     * Создать пользователя или обновить его профиль, если он уже зарегистрирован.
     *
     * @return количество затронутых строк
     */
    @Modifying
    @Query("""
            INSERT INTO calendar.tg_user (tg_id, username, first_name, last_name, created_at, updated_at)
            VALUES (:tgId, :username, :firstName, :lastName, NOW(), NOW())
            ON CONFLICT (tg_id) DO UPDATE
               SET username = EXCLUDED.username,
                   first_name = EXCLUDED.first_name,
                   last_name = EXCLUDED.last_name,
                   updated_at = NOW()
            """)
    Mono<Integer> upsert(Long tgId, String username, String firstName, String lastName);
}
