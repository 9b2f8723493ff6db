package ru.oparin.calendar.service.conversation;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Шаги диалогов. Порядок шагов внутри диалога задаёт {@link FlowType}.
 */
@Getter
@RequiredArgsConstructor
public enum FlowStep {

    NAME("name", StepInputType.TEXT, "Введите название события:"),
    DATE("date", StepInputType.DATE, "Введите дату события в формате ГГГГ-ММ-ДД (например, 2025-11-03):"),
    TIME("time", StepInputType.TIME, "Введите время события в формате ЧЧ:ММ (например, 14:30):"),
    DETAILS("details", StepInputType.TEXT, "Введите описание события:"),
    EVENT_ID("event_id", StepInputType.POSITIVE_ID, "Введите ID события:"),
    NEW_DETAILS("new_details", StepInputType.TEXT, "Введите новое описание события:"),
    PARTICIPANT_ID("participant_id", StepInputType.POSITIVE_ID, "Введите Telegram ID пользователя, которого хотите пригласить:"),
    DETAILS_OR_SKIP("details", StepInputType.OPTIONAL_TEXT,
            "Введите описание встречи или нажмите «Пропустить», чтобы взять описание события:"),
    VISIBILITY("is_public", StepInputType.VISIBILITY, "Сделать событие публичным? Ответьте «да» или «нет»:");

    /**
     * Ключ, под которым значение шага сохраняется в данных диалога.
     */
    private final String key;

    private final StepInputType inputType;

    private final String prompt;
}
