package ru.oparin.calendar.service.conversation;

import java.util.Optional;

/**
 * Результат запуска диалога.
 *
 * @param session      новый диалог
 * @param replacedFlow диалог, который был прерван запуском нового
 */
public record FlowStart(ConversationSession session, Optional<FlowType> replacedFlow) {

    public FlowStep firstStep() {
        return session.currentStep();
    }
}
