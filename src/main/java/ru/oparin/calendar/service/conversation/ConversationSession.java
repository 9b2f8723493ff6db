package ru.oparin.calendar.service.conversation;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Активный диалог пользователя: тип диалога, номер шага и собранные значения.
 * Экземпляр принадлежит одному пользователю и изменяется только при обработке его обновлений.
 */
@Getter
@ToString
public class ConversationSession {

    private final Long userId;
    private final FlowType flow;
    private final Instant startedAt;
    private int step;
    private final LinkedHashMap<String, Object> data;

    public ConversationSession(Long userId, FlowType flow, Instant startedAt) {
        this(userId, flow, startedAt, 0, new LinkedHashMap<>());
    }

    private ConversationSession(Long userId, FlowType flow, Instant startedAt, int step, LinkedHashMap<String, Object> data) {
        this.userId = userId;
        this.flow = flow;
        this.startedAt = startedAt;
        this.step = step;
        this.data = data;
    }

    public FlowStep currentStep() {
        return flow.stepAt(step);
    }

    public boolean isComplete() {
        return step >= flow.length();
    }

    /**
     * Сохранить значение текущего шага и перейти к следующему.
     */
    void accept(Object value) {
        data.put(currentStep().getKey(), value);
        step++;
    }

    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    public ConversationSession copy() {
        return new ConversationSession(userId, flow, startedAt, step, new LinkedHashMap<>(data));
    }
}
