package ru.oparin.calendar.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Criteria;
import org.springframework.data.relational.core.query.Query;
import org.springframework.data.relational.core.query.Update;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.calendar.exception.EventNotFoundException;
import ru.oparin.calendar.exception.NotOwnerException;
import ru.oparin.calendar.model.entity.Event;
import ru.oparin.calendar.repository.EventRepository;
import ru.oparin.calendar.util.StorageErrors;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Хранилище событий. Все изменения доступны только владельцу события.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventService {

    private final EventRepository eventRepository;
    private final R2dbcEntityTemplate r2dbcEntityTemplate;
    private final Clock clock;

    public Mono<Event> get(Long id) {
        return StorageErrors.guard(eventRepository.findById(id), "чтение события")
                .switchIfEmpty(Mono.error(() -> new EventNotFoundException(id)));
    }

    /**
     * Событие, принадлежащее владельцу.
     * Чужое событие даёт {@link NotOwnerException}, отсутствующее {@link EventNotFoundException}.
     */
    public Mono<Event> getOwned(Long id, Long ownerId) {
        return get(id)
                .flatMap(event -> ownerId.equals(event.getOwnerId())
                        ? Mono.just(event)
                        : Mono.error(new NotOwnerException(id)));
    }

    public Flux<Event> listByOwner(Long ownerId) {
        return StorageErrors.guard(eventRepository.findByOwnerOrdered(ownerId), "список событий");
    }

    public Flux<Event> listPublic(Long ownerId) {
        return StorageErrors.guard(eventRepository.findPublicByOwner(ownerId), "список публичных событий");
    }

    public Mono<Event> create(Long ownerId, String title, LocalDate date, LocalTime time, String details) {
        Event event = Event.builder()
                .ownerId(ownerId)
                .title(title)
                .date(date)
                .time(time)
                .details(details)
                .isPublic(false)
                .build();
        return StorageErrors.guard(eventRepository.save(event), "создание события")
                .doOnSuccess(saved -> log.info("Пользователь {} создал событие #{} на {} {}",
                        ownerId, saved.getId(), date, time));
    }

    public Mono<Event> updateDetails(Long id, Long ownerId, String details) {
        return getOwned(id, ownerId)
                .flatMap(event -> applyUpdate(id, Update.update("details", details), "изменение описания"))
                .doOnSuccess(updated -> log.info("Пользователь {} изменил описание события #{}", ownerId, id));
    }

    public Mono<Event> setVisibility(Long id, Long ownerId, boolean isPublic) {
        return getOwned(id, ownerId)
                .flatMap(event -> applyUpdate(id, Update.update("isPublic", isPublic), "изменение публичности"))
                .doOnSuccess(updated -> log.info("Пользователь {} сделал событие #{} {}",
                        ownerId, id, isPublic ? "публичным" : "приватным"));
    }

    public Mono<Void> delete(Long id, Long ownerId) {
        return getOwned(id, ownerId)
                .flatMap(event -> StorageErrors.guard(eventRepository.delete(event), "удаление события"))
                .doOnSuccess(v -> log.info("Пользователь {} удалил событие #{}", ownerId, id));
    }

    private Mono<Event> applyUpdate(Long id, Update update, String operation) {
        Mono<Event> updated = r2dbcEntityTemplate.update(Event.class)
                .matching(Query.query(Criteria.where("id").is(id)))
                .apply(update.set("updatedAt", LocalDateTime.now(clock)))
                .then(eventRepository.findById(id));
        return StorageErrors.guard(updated, operation);
    }
}
