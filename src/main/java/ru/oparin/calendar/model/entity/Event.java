package ru.oparin.calendar.model.entity;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Событие календаря пользователя.
 * Изменять и удалять событие может только его владелец.
 */
@Table(value = "event", schema = "calendar")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    /**
     * Уникальный идентификатор события.
     */
    @Id
    private Long id;

    /**
     * ID владельца события в Telegram.
     */
    private Long ownerId;

    /**
     * Название события.
     */
    @Column("name")
    private String title;

    /**
     * Дата события.
     */
    private LocalDate date;

    /**
     * Время начала события.
     */
    private LocalTime time;

    /**
     * Описание события.
     */
    private String details;

    /**
     * Видно ли событие в публичном списке владельца.
     */
    @Builder.Default
    private Boolean isPublic = false;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;
}
