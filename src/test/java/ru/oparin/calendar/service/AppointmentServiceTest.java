package ru.oparin.calendar.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.calendar.exception.ConversationInputException;
import ru.oparin.calendar.exception.InvalidTransitionException;
import ru.oparin.calendar.exception.NotParticipantException;
import ru.oparin.calendar.exception.SlotBusyException;
import ru.oparin.calendar.exception.SlotContentionException;
import ru.oparin.calendar.exception.StorageUnavailableException;
import ru.oparin.calendar.model.entity.Appointment;
import ru.oparin.calendar.model.entity.Event;
import ru.oparin.calendar.model.enums.AppointmentDecision;
import ru.oparin.calendar.model.enums.AppointmentStatus;
import ru.oparin.calendar.repository.AppointmentRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AppointmentServiceTest {

    private static final LocalDate DATE = LocalDate.of(2025, 12, 12);
    private static final LocalTime TIME = LocalTime.of(12, 0);

    @Mock
    private AppointmentRepository appointmentRepository;

    @Mock
    private EventService eventService;

    @Mock
    private TransactionalOperator transactionalOperator;

    private final Map<Long, Appointment> table = new LinkedHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    private AppointmentService appointmentService;

    @BeforeEach
    void setUp() {
        appointmentService = new AppointmentService(appointmentRepository, eventService, transactionalOperator,
                Clock.fixed(Instant.parse("2025-11-01T10:00:00Z"), ZoneOffset.UTC));

        lenient().when(transactionalOperator.transactional(any(Mono.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        lenient().when(appointmentRepository.countBusySlots(anyLong(), any(), any()))
                .thenAnswer(invocation -> Mono.fromCallable(() -> table.values().stream()
                        .filter(a -> a.involves(invocation.getArgument(0)))
                        .filter(a -> a.getDate().equals(invocation.getArgument(1)) && a.getTime().equals(invocation.getArgument(2)))
                        .filter(a -> a.getStatus().isBusy())
                        .count()));
        lenient().when(appointmentRepository.save(any(Appointment.class)))
                .thenAnswer(invocation -> Mono.fromCallable(() -> {
                    Appointment appointment = invocation.getArgument(0);
                    appointment.setId(ids.incrementAndGet());
                    table.put(appointment.getId(), appointment.toBuilder().build());
                    return appointment;
                }));
        lenient().when(appointmentRepository.findById(anyLong()))
                .thenAnswer(invocation -> Mono.justOrEmpty(table.get(invocation.<Long>getArgument(0)))
                        .map(a -> a.toBuilder().build()));
        lenient().when(appointmentRepository.compareAndSetStatus(anyLong(), anyString(), anyString(), any(LocalDateTime.class)))
                .thenAnswer(invocation -> Mono.fromCallable(() -> {
                    Appointment stored = table.get(invocation.<Long>getArgument(0));
                    if (stored == null || !stored.getStatus().name().equals(invocation.getArgument(1))) {
                        return 0;
                    }
                    stored.setStatus(AppointmentStatus.valueOf(invocation.getArgument(2)));
                    return 1;
                }));
    }

    @Test
    void invitationScenarioFromCreationToCancellation() {
        // Given: организатор 1 приглашает свободного участника 2
        StepVerifier.create(appointmentService.createInvite(1L, 2L, 10L, DATE, TIME, "Обсуждение"))
                .assertNext(appointment -> assertThat(appointment.getStatus()).isEqualTo(AppointmentStatus.PENDING))
                .verifyComplete();

        // When: организатор 3 приглашает участника 2 на тот же слот
        StepVerifier.create(appointmentService.createInvite(3L, 2L, 11L, DATE, TIME, "Другая встреча"))
                .expectError(SlotBusyException.class)
                .verify();

        // Then: участник подтверждает, организатор отменяет, слот освобождается
        StepVerifier.create(appointmentService.respond(1L, 2L, AppointmentDecision.CONFIRM))
                .assertNext(appointment -> assertThat(appointment.getStatus()).isEqualTo(AppointmentStatus.CONFIRMED))
                .verifyComplete();
        StepVerifier.create(appointmentService.cancel(1L, 1L))
                .assertNext(appointment -> assertThat(appointment.getStatus()).isEqualTo(AppointmentStatus.CANCELLED))
                .verifyComplete();
        StepVerifier.create(appointmentService.isFree(2L, DATE, TIME))
                .expectNext(true)
                .verifyComplete();
        assertThat(table).hasSize(1);
    }

    @Test
    void busyParticipantGetsNoSecondRecord() {
        appointmentService.createInvite(1L, 2L, 10L, DATE, TIME, null).block();

        StepVerifier.create(appointmentService.createInvite(5L, 2L, 12L, DATE, TIME, null))
                .expectError(SlotBusyException.class)
                .verify();

        assertThat(table.values()).filteredOn(a -> a.getParticipantId().equals(2L)).hasSize(1);
    }

    @Test
    void participantBusyAsOrganizerIsNotFree() {
        appointmentService.createInvite(2L, 9L, 10L, DATE, TIME, null).block();

        StepVerifier.create(appointmentService.createInvite(1L, 2L, 11L, DATE, TIME, null))
                .expectError(SlotBusyException.class)
                .verify();
    }

    @Test
    void otherTimeOnSameDateIsFree() {
        appointmentService.createInvite(1L, 2L, 10L, DATE, TIME, null).block();

        StepVerifier.create(appointmentService.createInvite(3L, 2L, 11L, DATE, TIME.plusMinutes(30), null))
                .assertNext(appointment -> assertThat(appointment.getId()).isEqualTo(2L))
                .verifyComplete();
    }

    @Test
    void secondResponseIsInvalidTransitionAndKeepsFirstOutcome() {
        // Given
        appointmentService.createInvite(1L, 2L, 10L, DATE, TIME, null).block();
        appointmentService.respond(1L, 2L, AppointmentDecision.DECLINE).block();

        // When / Then
        StepVerifier.create(appointmentService.respond(1L, 2L, AppointmentDecision.CONFIRM))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(InvalidTransitionException.class)
                        .extracting("currentStatus").isEqualTo(AppointmentStatus.DECLINED))
                .verify();
        assertThat(table.get(1L).getStatus()).isEqualTo(AppointmentStatus.DECLINED);
    }

    @Test
    void declineFreesTheSlot() {
        appointmentService.createInvite(1L, 2L, 10L, DATE, TIME, null).block();
        appointmentService.respond(1L, 2L, AppointmentDecision.DECLINE).block();

        StepVerifier.create(appointmentService.isFree(2L, DATE, TIME))
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    void onlyParticipantMayRespond() {
        appointmentService.createInvite(1L, 2L, 10L, DATE, TIME, null).block();

        StepVerifier.create(appointmentService.respond(1L, 1L, AppointmentDecision.CONFIRM))
                .expectError(NotParticipantException.class)
                .verify();
        assertThat(table.get(1L).getStatus()).isEqualTo(AppointmentStatus.PENDING);
    }

    @Test
    void outsiderCannotCancel() {
        appointmentService.createInvite(1L, 2L, 10L, DATE, TIME, null).block();

        StepVerifier.create(appointmentService.cancel(1L, 3L))
                .expectError(NotParticipantException.class)
                .verify();
    }

    @Test
    void cancelledInvitationCannotBeCancelledAgain() {
        appointmentService.createInvite(1L, 2L, 10L, DATE, TIME, null).block();
        appointmentService.cancel(1L, 2L).block();

        StepVerifier.create(appointmentService.cancel(1L, 1L))
                .expectError(InvalidTransitionException.class)
                .verify();
    }

    @Test
    void concurrentStatusChangeIsReportedAsInvalidTransition() {
        // Given: приглашение прочитано в статусе PENDING, но параллельно уже подтверждено
        appointmentService.createInvite(1L, 2L, 10L, DATE, TIME, null).block();
        Appointment stale = table.get(1L).toBuilder().build();
        table.get(1L).setStatus(AppointmentStatus.CONFIRMED);
        when(appointmentRepository.findById(1L))
                .thenReturn(Mono.just(stale), Mono.just(table.get(1L).toBuilder().build()));

        // When / Then
        StepVerifier.create(appointmentService.respond(1L, 2L, AppointmentDecision.DECLINE))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(InvalidTransitionException.class)
                        .extracting("currentStatus").isEqualTo(AppointmentStatus.CONFIRMED))
                .verify();
        assertThat(table.get(1L).getStatus()).isEqualTo(AppointmentStatus.CONFIRMED);
    }

    @Test
    void uniqueIndexViolationIsReportedAsBusy() {
        when(appointmentRepository.save(any(Appointment.class)))
                .thenReturn(Mono.error(new DuplicateKeyException("uq_appointment_participant_slot")));

        StepVerifier.create(appointmentService.createInvite(1L, 2L, 10L, DATE, TIME, null))
                .expectError(SlotBusyException.class)
                .verify();
    }

    @Test
    void serializationConflictIsRetried() {
        // Given: первая попытка прерывается конфликтом сериализации
        AtomicInteger attempts = new AtomicInteger();
        when(appointmentRepository.save(any(Appointment.class))).thenAnswer(invocation -> Mono.defer(() -> {
            if (attempts.incrementAndGet() == 1) {
                return Mono.error(new ConcurrencyFailureException("could not serialize access"));
            }
            Appointment appointment = invocation.getArgument(0);
            appointment.setId(ids.incrementAndGet());
            table.put(appointment.getId(), appointment.toBuilder().build());
            return Mono.just(appointment);
        }));

        // When / Then
        StepVerifier.create(appointmentService.createInvite(1L, 2L, 10L, DATE, TIME, null))
                .assertNext(appointment -> assertThat(appointment.getStatus()).isEqualTo(AppointmentStatus.PENDING))
                .verifyComplete();
        assertThat(attempts).hasValue(2);
        assertThat(table).hasSize(1);
    }

    @Test
    void persistentSerializationConflictIsReportedAsContention() {
        when(appointmentRepository.save(any(Appointment.class)))
                .thenReturn(Mono.error(new ConcurrencyFailureException("could not serialize access")));

        StepVerifier.create(appointmentService.createInvite(1L, 2L, 10L, DATE, TIME, null))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(SlotContentionException.class)
                        .hasCauseInstanceOf(ConcurrencyFailureException.class))
                .verify(Duration.ofSeconds(10));
        assertThat(table).isEmpty();
        verify(appointmentRepository, times(4)).save(any(Appointment.class));
    }

    @Test
    void lostDatabaseConnectionIsStorageUnavailable() {
        when(appointmentRepository.countBusySlots(anyLong(), any(), any()))
                .thenReturn(Mono.error(new DataAccessResourceFailureException("connection refused")));

        StepVerifier.create(appointmentService.createInvite(1L, 2L, 10L, DATE, TIME, null))
                .expectError(StorageUnavailableException.class)
                .verify();
        verify(appointmentRepository, never()).save(any(Appointment.class));
    }

    @Test
    void inviteToEventCopiesSlotAndDefaultsDetails() {
        // Given
        Event event = Event.builder().id(10L).ownerId(1L).title("Созвон").date(DATE).time(TIME)
                .details("Еженедельный созвон").build();
        when(eventService.getOwned(10L, 1L)).thenReturn(Mono.just(event));

        // When / Then
        StepVerifier.create(appointmentService.inviteToEvent(1L, 2L, 10L, ""))
                .assertNext(appointment -> {
                    assertThat(appointment.getDate()).isEqualTo(DATE);
                    assertThat(appointment.getTime()).isEqualTo(TIME);
                    assertThat(appointment.getDetails()).isEqualTo("Еженедельный созвон");
                    assertThat(appointment.getEventId()).isEqualTo(10L);
                })
                .verifyComplete();
    }

    @Test
    void selfInvitationIsRejected() {
        StepVerifier.create(appointmentService.inviteToEvent(1L, 1L, 10L, null))
                .expectError(ConversationInputException.class)
                .verify();
    }

    @Test
    void busySlotsAreListedForIdentity() {
        when(appointmentRepository.findBusyBetween(2L, DATE, DATE))
                .thenReturn(Flux.just(Appointment.builder().id(1L).date(DATE).time(TIME).build()));

        StepVerifier.create(appointmentService.findBusySlots(2L, DATE, DATE))
                .expectNextCount(1)
                .verifyComplete();
    }
}
