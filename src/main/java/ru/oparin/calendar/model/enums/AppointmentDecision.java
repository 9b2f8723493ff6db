package ru.oparin.calendar.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Решение участника по приглашению (inline-кнопки в Telegram).
 */
@Getter
@RequiredArgsConstructor
public enum AppointmentDecision {

    CONFIRM("ok", AppointmentStatus.CONFIRMED),
    DECLINE("no", AppointmentStatus.DECLINED);

    /**
     * Код решения в callback_data кнопки: appt:&lt;code&gt;:&lt;id&gt;.
     */
    private final String callbackCode;

    private final AppointmentStatus targetStatus;

    public static Optional<AppointmentDecision> fromCallbackCode(String code) {
        return Arrays.stream(values())
                .filter(decision -> decision.callbackCode.equals(code))
                .findFirst();
    }
}
