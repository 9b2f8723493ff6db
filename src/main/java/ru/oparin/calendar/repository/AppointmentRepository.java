package ru.oparin.calendar.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.calendar.model.entity.Appointment;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Репозиторий встреч.
 * Занятым считается слот встречи в статусе PENDING или CONFIRMED.
 */
public interface AppointmentRepository extends ReactiveCrudRepository<Appointment, Long> {

    /**
     * Количество активных встреч пользователя (как организатора или участника) в точном слоте.
     *
     * @param userId ID пользователя
     * @param date   дата слота
     * @param time   время слота
     * @return число встреч, занимающих слот
     */
    @Query("""
            SELECT COUNT(*) FROM calendar.appointment
            WHERE (organizer_id = :userId OR participant_id = :userId)
              AND date = :date AND time = :time
              AND status IN ('PENDING', 'CONFIRMED')
            """)
    Mono<Long> countBusySlots(Long userId, LocalDate date, LocalTime time);

    /**
     * Активные встречи пользователя в диапазоне дат включительно.
     */
    @Query("""
            SELECT * FROM calendar.appointment
            WHERE (organizer_id = :userId OR participant_id = :userId)
              AND date BETWEEN :from AND :to
              AND status IN ('PENDING', 'CONFIRMED')
            ORDER BY date, time, id
            """)
    Flux<Appointment> findBusyBetween(Long userId, LocalDate from, LocalDate to);

    /**
     * Все встречи, где пользователь организатор или участник, новые первыми.
     */
    @Query("""
            SELECT * FROM calendar.appointment
            WHERE organizer_id = :userId OR participant_id = :userId
            ORDER BY created_at DESC, id DESC
            """)
    Flux<Appointment> findByMember(Long userId);

    /**
     * Сменить статус встречи, только если текущий статус равен ожидаемому.
     *
     * @return 1 при успешной смене, 0 если статус уже изменился
     */
    @Modifying
    @Query("""
            UPDATE calendar.appointment
               SET status = :newStatus, updated_at = :updatedAt
             WHERE id = :id AND status = :expected
            """)
    Mono<Integer> compareAndSetStatus(Long id, String expected, String newStatus, LocalDateTime updatedAt);
}
