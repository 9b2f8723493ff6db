package ru.oparin.calendar.model.entity;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Зарегистрированный пользователь Telegram.
 * Ключом служит ID аккаунта в Telegram, он же идентификатор пользователя во всех таблицах.
 */
@Table(value = "tg_user", schema = "calendar")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TgUser {

    /**
     * ID пользователя в Telegram (первичный ключ).
     */
    @Id
    private Long tgId;

    /**
     * Username в Telegram (может отсутствовать).
     */
    private String username;

    private String firstName;

    private String lastName;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;
}
