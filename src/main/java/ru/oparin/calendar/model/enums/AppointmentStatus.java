package ru.oparin.calendar.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Статусы встречи (приглашения).
 * <p>
 * Допустимые переходы: PENDING -> CONFIRMED | DECLINED | CANCELLED, CONFIRMED -> CANCELLED.
 * DECLINED и CANCELLED конечные. Слот участника занимают только PENDING и CONFIRMED.
 */
@Getter
@RequiredArgsConstructor
public enum AppointmentStatus {

    /**
     * Ожидает ответа участника
     */
    PENDING("Ожидает подтверждения"),

    /**
     * Подтверждена участником
     */
    CONFIRMED("Подтверждено"),

    /**
     * Отклонена участником
     */
    DECLINED("Отклонено"),

    /**
     * Отменена организатором или участником
     */
    CANCELLED("Отменено");

    private final String displayName;

    /**
     * Занимает ли встреча в этом статусе временной слот.
     */
    public boolean isBusy() {
        return this == PENDING || this == CONFIRMED;
    }

    public boolean isTerminal() {
        return this == DECLINED || this == CANCELLED;
    }

    public boolean canTransitionTo(AppointmentStatus target) {
        if (isTerminal()) {
            return false;
        }
        return this == PENDING ? target != PENDING : target == CANCELLED;
    }
}
