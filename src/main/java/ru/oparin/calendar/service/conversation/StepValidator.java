package ru.oparin.calendar.service.conversation;

import reactor.core.publisher.Mono;

/**
 * Асинхронная проверка значения шага до его сохранения в диалоге.
 * Отказ выражается ошибкой {@link ru.oparin.calendar.exception.ConversationInputException}.
 */
@FunctionalInterface
public interface StepValidator {

    StepValidator NONE = (session, step, value) -> Mono.empty();

    Mono<Void> validate(ConversationSession session, FlowStep step, Object value);
}
