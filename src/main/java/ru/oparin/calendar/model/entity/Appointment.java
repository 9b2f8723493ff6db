package ru.oparin.calendar.model.entity;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.relational.core.mapping.Table;
import ru.oparin.calendar.model.enums.AppointmentStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Встреча (приглашение), привязанная к событию организатора.
 * Физически не удаляется: отмена выражается статусом.
 */
@Table(value = "appointment", schema = "calendar")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Appointment {

    /**
     * Уникальный идентификатор встречи.
     */
    @Id
    private Long id;

    /**
     * ID события, к которому привязана встреча.
     * Логическая ссылка без внешнего ключа.
     */
    private Long eventId;

    /**
     * ID организатора в Telegram.
     */
    private Long organizerId;

    /**
     * ID приглашённого участника в Telegram.
     */
    private Long participantId;

    /**
     * Дата встречи (копия даты события на момент приглашения).
     */
    private LocalDate date;

    /**
     * Время встречи (копия времени события на момент приглашения).
     */
    private LocalTime time;

    /**
     * Описание встречи.
     */
    private String details;

    /**
     * Текущий статус встречи.
     */
    @Builder.Default
    private AppointmentStatus status = AppointmentStatus.PENDING;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    /**
     * Является ли пользователь стороной встречи (организатором или участником).
     */
    public boolean involves(Long userId) {
        return userId != null && (userId.equals(organizerId) || userId.equals(participantId));
    }

    /**
     * Вторая сторона встречи относительно указанного пользователя.
     */
    public Long counterpartOf(Long userId) {
        return userId != null && userId.equals(organizerId) ? participantId : organizerId;
    }
}
