package ru.oparin.calendar.service.conversation;

import lombok.Getter;

import java.util.List;

/**
 * Диалоги бота с фиксированной последовательностью шагов.
 */
@Getter
public enum FlowType {

    NONE("нет диалога"),
    CREATE("создание события", FlowStep.NAME, FlowStep.DATE, FlowStep.TIME, FlowStep.DETAILS),
    EDIT("редактирование события", FlowStep.EVENT_ID, FlowStep.NEW_DETAILS),
    DELETE("удаление события", FlowStep.EVENT_ID),
    INVITE("приглашение на встречу", FlowStep.PARTICIPANT_ID, FlowStep.EVENT_ID, FlowStep.DETAILS_OR_SKIP),
    SHARE("настройка публичности", FlowStep.EVENT_ID, FlowStep.VISIBILITY);

    private final String displayName;
    private final List<FlowStep> steps;

    FlowType(String displayName, FlowStep... steps) {
        this.displayName = displayName;
        this.steps = List.of(steps);
    }

    public int length() {
        return steps.size();
    }

    public FlowStep stepAt(int index) {
        return steps.get(index);
    }
}
