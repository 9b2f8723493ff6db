package ru.oparin.calendar.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import ru.oparin.calendar.exception.AppointmentNotFoundException;
import ru.oparin.calendar.exception.ConversationInputException;
import ru.oparin.calendar.exception.InvalidTransitionException;
import ru.oparin.calendar.exception.NotParticipantException;
import ru.oparin.calendar.exception.SlotBusyException;
import ru.oparin.calendar.exception.SlotContentionException;
import ru.oparin.calendar.model.entity.Appointment;
import ru.oparin.calendar.model.enums.AppointmentDecision;
import ru.oparin.calendar.model.enums.AppointmentStatus;
import ru.oparin.calendar.repository.AppointmentRepository;
import ru.oparin.calendar.util.StorageErrors;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Встречи: проверка занятости слотов и переходы статусов приглашений.
 * <p>
 * Таблицу встреч изменяет только этот сервис. Слот (участник, дата, время) может занимать
 * не больше одной встречи в статусе PENDING или CONFIRMED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentService {

    private static final int SERIALIZATION_RETRIES = 3;
    private static final Duration SERIALIZATION_BACKOFF = Duration.ofMillis(50);

    private final AppointmentRepository appointmentRepository;
    private final EventService eventService;
    private final TransactionalOperator serializableTransactionalOperator;
    private final Clock clock;

    /**
     * Свободен ли пользователь в точный слот: нет активных встреч, где он организатор или участник.
     */
    public Mono<Boolean> isFree(Long userId, LocalDate date, LocalTime time) {
        return StorageErrors.guard(appointmentRepository.countBusySlots(userId, date, time), "проверка слота")
                .map(count -> count == 0);
    }

    /**
     * Пригласить участника на событие организатора.
     * Событие должно принадлежать организатору, пустое описание заменяется описанием события.
     */
    public Mono<Appointment> inviteToEvent(Long organizerId, Long participantId, Long eventId, String details) {
        if (organizerId.equals(participantId)) {
            return Mono.error(new ConversationInputException("Нельзя пригласить самого себя. Укажите другой ID:"));
        }
        return eventService.getOwned(eventId, organizerId)
                .flatMap(event -> createInvite(organizerId, participantId, event.getId(), event.getDate(), event.getTime(),
                        details == null || details.isBlank() ? event.getDetails() : details));
    }

    /**
     * Создать приглашение в статусе PENDING, если участник свободен.
     * Проверка и вставка выполняются в одной транзакции SERIALIZABLE, дополнительно слот защищён
     * частичным уникальным индексом. При конфликте ничего не записывается и возвращается {@link SlotBusyException}.
     * Если конфликт сериализации повторяется после всех попыток, возвращается {@link SlotContentionException}:
     * PostgreSQL прерывает транзакции и при конфликтах, не связанных со слотом участника.
     */
    public Mono<Appointment> createInvite(Long organizerId, Long participantId, Long eventId,
                                         LocalDate date, LocalTime time, String details) {
        Mono<Appointment> checkAndInsert = Mono.defer(() -> isFree(participantId, date, time)
                .flatMap(free -> {
                    if (!free) {
                        return Mono.error(new SlotBusyException(participantId, date, time));
                    }
                    Appointment appointment = Appointment.builder()
                            .eventId(eventId)
                            .organizerId(organizerId)
                            .participantId(participantId)
                            .date(date)
                            .time(time)
                            .details(details)
                            .status(AppointmentStatus.PENDING)
                            .build();
                    return appointmentRepository.save(appointment);
                }));

        return serializableTransactionalOperator.transactional(checkAndInsert)
                .retryWhen(Retry.backoff(SERIALIZATION_RETRIES, SERIALIZATION_BACKOFF)
                        .filter(ConcurrencyFailureException.class::isInstance)
                        .onRetryExhaustedThrow((spec, signal) -> new SlotContentionException(participantId, signal.failure())))
                .onErrorMap(DuplicateKeyException.class, e -> new SlotBusyException(participantId, date, time))
                .transform(mono -> StorageErrors.guard(mono, "создание приглашения"))
                .doOnSuccess(saved -> log.info("Создано приглашение #{}: организатор {}, участник {}, {} {}",
                        saved.getId(), organizerId, participantId, date, time))
                .doOnError(SlotBusyException.class, e -> log.info("Приглашение отклонено: {}", e.getMessage()))
                .doOnError(SlotContentionException.class, e -> log.warn("Приглашение не сохранено после {} повторов: {}",
                        SERIALIZATION_RETRIES, e.getMessage()));
    }

    /**
     * Ответ участника на приглашение. Допустим только из статуса PENDING.
     */
    public Mono<Appointment> respond(Long appointmentId, Long responderId, AppointmentDecision decision) {
        AppointmentStatus target = decision.getTargetStatus();
        return findOrThrow(appointmentId)
                .flatMap(appointment -> {
                    if (!responderId.equals(appointment.getParticipantId())) {
                        log.warn("Пользователь {} пытался ответить на чужое приглашение #{}", responderId, appointmentId);
                        return Mono.error(new NotParticipantException(appointmentId));
                    }
                    if (appointment.getStatus() != AppointmentStatus.PENDING) {
                        return Mono.error(new InvalidTransitionException(appointmentId, appointment.getStatus(), target));
                    }
                    return transition(appointment, AppointmentStatus.PENDING, target);
                })
                .doOnSuccess(updated -> log.info("Участник {} ответил на приглашение #{}: {}",
                        responderId, appointmentId, target));
    }

    /**
     * Отмена встречи организатором или участником. Освобождает слот.
     */
    public Mono<Appointment> cancel(Long appointmentId, Long requesterId) {
        return findOrThrow(appointmentId)
                .flatMap(appointment -> {
                    if (!appointment.involves(requesterId)) {
                        log.warn("Пользователь {} пытался отменить чужую встречу #{}", requesterId, appointmentId);
                        return Mono.error(new NotParticipantException(appointmentId));
                    }
                    AppointmentStatus current = appointment.getStatus();
                    if (!current.canTransitionTo(AppointmentStatus.CANCELLED)) {
                        return Mono.error(new InvalidTransitionException(appointmentId, current, AppointmentStatus.CANCELLED));
                    }
                    return transition(appointment, current, AppointmentStatus.CANCELLED);
                })
                .doOnSuccess(updated -> log.info("Пользователь {} отменил встречу #{}", requesterId, appointmentId));
    }

    /**
     * Активные встречи пользователя в диапазоне дат.
     */
    public Flux<Appointment> findBusySlots(Long userId, LocalDate from, LocalDate to) {
        return StorageErrors.guard(appointmentRepository.findBusyBetween(userId, from, to), "список занятых слотов");
    }

    /**
     * Все встречи, где пользователь организатор или участник, новые первыми.
     */
    public Flux<Appointment> findForIdentity(Long userId) {
        return StorageErrors.guard(appointmentRepository.findByMember(userId), "список встреч");
    }

    private Mono<Appointment> findOrThrow(Long appointmentId) {
        return StorageErrors.guard(appointmentRepository.findById(appointmentId), "чтение встречи")
                .switchIfEmpty(Mono.error(() -> new AppointmentNotFoundException(appointmentId)));
    }

    /**
     * Условная смена статуса: если статус уже изменился параллельно, переход не применяется.
     */
    private Mono<Appointment> transition(Appointment appointment, AppointmentStatus expected, AppointmentStatus target) {
        LocalDateTime now = LocalDateTime.now(clock);
        Mono<Appointment> update = appointmentRepository
                .compareAndSetStatus(appointment.getId(), expected.name(), target.name(), now)
                .flatMap(rows -> {
                    if (rows > 0) {
                        return Mono.just(appointment.toBuilder().status(target).updatedAt(now).build());
                    }
                    return appointmentRepository.findById(appointment.getId())
                            .map(Appointment::getStatus)
                            .defaultIfEmpty(expected)
                            .flatMap(current -> Mono.error(
                                    new InvalidTransitionException(appointment.getId(), current, target)));
                });
        return StorageErrors.guard(update, "смена статуса встречи");
    }
}
