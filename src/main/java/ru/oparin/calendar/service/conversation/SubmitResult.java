package ru.oparin.calendar.service.conversation;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collections;
import java.util.Map;

/**
 * Результат обработки ввода в диалоге.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class SubmitResult {

    public enum Outcome {
        /**
         * Значение принято, диалог перешёл к следующему шагу
         */
        ADVANCED,
        /**
         * Собраны все значения, диалог завершён
         */
        COMPLETED,
        /**
         * Ввод отклонён, диалог остался на том же шаге
         */
        FAILED,
        /**
         * У пользователя нет активного диалога
         */
        NO_SESSION
    }

    private final Outcome outcome;
    private final FlowType flow;
    /**
     * Следующий шаг для ADVANCED, текущий шаг для FAILED.
     */
    private final FlowStep step;
    private final String reason;
    private final Map<String, Object> fields;
    /**
     * Состояние диалога перед последним шагом, для восстановления при сбое завершающего действия.
     */
    @ToString.Exclude
    private final ConversationSession resumePoint;

    static SubmitResult advanced(FlowType flow, FlowStep next) {
        return new SubmitResult(Outcome.ADVANCED, flow, next, null, Collections.emptyMap(), null);
    }

    static SubmitResult completed(FlowType flow, Map<String, Object> fields, ConversationSession resumePoint) {
        return new SubmitResult(Outcome.COMPLETED, flow, null, null, Collections.unmodifiableMap(fields), resumePoint);
    }

    static SubmitResult failed(FlowType flow, FlowStep step, String reason) {
        return new SubmitResult(Outcome.FAILED, flow, step, reason, Collections.emptyMap(), null);
    }

    static SubmitResult noSession() {
        return new SubmitResult(Outcome.NO_SESSION, FlowType.NONE, null, null, Collections.emptyMap(), null);
    }

    public boolean is(Outcome expected) {
        return outcome == expected;
    }

    public String text(FlowStep step) {
        return (String) fields.get(step.getKey());
    }

    public Long id(FlowStep step) {
        return (Long) fields.get(step.getKey());
    }

    public LocalDate date(FlowStep step) {
        return (LocalDate) fields.get(step.getKey());
    }

    public LocalTime time(FlowStep step) {
        return (LocalTime) fields.get(step.getKey());
    }

    public Boolean flag(FlowStep step) {
        return (Boolean) fields.get(step.getKey());
    }
}
