package ru.oparin.calendar.repository;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import ru.oparin.calendar.model.entity.Event;

/**
 * Репозиторий событий календаря.
 */
public interface EventRepository extends ReactiveCrudRepository<Event, Long> {

    /**
     * Все события владельца в хронологическом порядке.
     *
     * @param ownerId ID владельца в Telegram
     * @return события, упорядоченные по дате, времени и ID
     */
    @Query("SELECT * FROM calendar.event WHERE owner_id = :ownerId ORDER BY date, time, id")
    Flux<Event> findByOwnerOrdered(Long ownerId);

    /**
     * Публичные события владельца в хронологическом порядке.
     *
     * @param ownerId ID владельца в Telegram
     * @return публичные события, упорядоченные по дате, времени и ID
     */
    @Query("SELECT * FROM calendar.event WHERE owner_id = :ownerId AND is_public = TRUE ORDER BY date, time, id")
    Flux<Event> findPublicByOwner(Long ownerId);
}
