package ru.oparin.calendar.service.telegram;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import reactor.core.publisher.Mono;
import ru.oparin.calendar.exception.ConversationInputException;
import ru.oparin.calendar.exception.EventNotFoundException;
import ru.oparin.calendar.exception.NotOwnerException;
import ru.oparin.calendar.exception.SlotContentionException;
import ru.oparin.calendar.exception.StorageUnavailableException;
import ru.oparin.calendar.service.AppointmentService;
import ru.oparin.calendar.service.EventService;
import ru.oparin.calendar.service.UserService;
import ru.oparin.calendar.service.conversation.ConversationEngine;
import ru.oparin.calendar.service.conversation.ConversationSession;
import ru.oparin.calendar.service.conversation.FlowStart;
import ru.oparin.calendar.service.conversation.FlowStep;
import ru.oparin.calendar.service.conversation.FlowType;
import ru.oparin.calendar.service.conversation.StepValidator;
import ru.oparin.calendar.service.conversation.SubmitResult;

/**
 * Диалоги бота: запуск, ввод на шагах и завершающие действия.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TelegramConversationHandler {

    private static final String EVENT_NOT_FOUND_RETRY = "Событие не найдено. Укажите корректный ID:";

    private final ConversationEngine conversationEngine;
    private final EventService eventService;
    private final AppointmentService appointmentService;
    private final UserService userService;
    private final AppointmentNotificationService notificationService;
    private final TelegramMessageService telegramMessageService;
    private final TelegramKeyboardFactory keyboardFactory;
    private final TelegramBotMessageBuilder messageBuilder;

    /**
     * Начать диалог и отправить подсказку первого шага.
     * Если у пользователя был другой незавершённый диалог, он заменяется с предупреждением.
     */
    public Mono<Void> startFlow(Long userId, FlowType flow) {
        FlowStart start = conversationEngine.startFlow(userId, flow);
        Mono<Void> warning = start.replacedFlow()
                .map(replaced -> telegramMessageService.sendMessage(userId, messageBuilder.buildFlowReplacedMessage(replaced)))
                .orElse(Mono.empty());
        return warning.then(prompt(userId, start.firstStep()));
    }

    /**
     * Обработать ввод в активном диалоге.
     */
    public Mono<Void> handleInput(Long userId, String text) {
        return conversationEngine.submit(userId, text, validatorFor(userId))
                .flatMap(result -> switch (result.getOutcome()) {
                    case ADVANCED -> prompt(userId, result.getStep());
                    case FAILED -> telegramMessageService.sendMessage(userId, result.getReason(), keyboardFor(result.getStep()));
                    case COMPLETED -> complete(userId, result);
                    case NO_SESSION -> telegramMessageService.sendMessage(userId, messageBuilder.buildUnknownCommandMessage());
                });
    }

    public Mono<Void> cancel(Long userId) {
        boolean hadFlow = conversationEngine.cancel(userId);
        return telegramMessageService.sendMessage(userId, messageBuilder.buildCancelledMessage(hadFlow),
                keyboardFactory.removeKeyboard());
    }

    public boolean hasActiveFlow(Long userId) {
        return conversationEngine.activeFlow(userId) != FlowType.NONE;
    }

    StepValidator validatorFor(Long userId) {
        return (session, step, value) -> switch (step) {
            case EVENT_ID -> requireOwnedEvent(userId, (Long) value);
            case PARTICIPANT_ID -> requireInvitee(userId, (Long) value);
            default -> Mono.empty();
        };
    }

    private Mono<Void> requireOwnedEvent(Long userId, Long eventId) {
        return eventService.getOwned(eventId, userId)
                .onErrorMap(error -> error instanceof EventNotFoundException || error instanceof NotOwnerException,
                        error -> new ConversationInputException(EVENT_NOT_FOUND_RETRY))
                .then();
    }

    private Mono<Void> requireInvitee(Long userId, Long participantId) {
        if (userId.equals(participantId)) {
            return Mono.error(new ConversationInputException("Нельзя пригласить самого себя. Укажите другой ID:"));
        }
        return userService.isRegistered(participantId)
                .flatMap(registered -> registered
                        ? Mono.<Void>empty()
                        : Mono.error(new ConversationInputException(
                                "Пользователь с таким ID не зарегистрирован в боте. Укажите другой ID:")));
    }

    /**
     * Выполнить завершающее действие диалога.
     * При недоступности хранилища, параллельном конфликте или отказе проверки диалог возвращается на последний шаг.
     */
    private Mono<Void> complete(Long userId, SubmitResult result) {
        ConversationSession resumePoint = result.getResumePoint();
        return completionAction(userId, result)
                .onErrorResume(StorageUnavailableException.class, error -> {
                    log.error("Хранилище недоступно при завершении диалога {} пользователя {}",
                            result.getFlow(), userId, error);
                    conversationEngine.restore(resumePoint);
                    return telegramMessageService.sendMessage(userId, messageBuilder.buildTemporaryUnavailableMessage());
                })
                .onErrorResume(SlotContentionException.class, error -> {
                    log.warn("Приглашение пользователя {} не сохранено: {}", userId, error.getMessage());
                    conversationEngine.restore(resumePoint);
                    return telegramMessageService.sendMessage(userId, messageBuilder.buildRetryLaterMessage());
                })
                .onErrorResume(ConversationInputException.class, error -> {
                    conversationEngine.restore(resumePoint);
                    return telegramMessageService.sendMessage(userId, error.getMessage(),
                            keyboardFor(resumePoint.currentStep()));
                });
    }

    private Mono<Void> completionAction(Long userId, SubmitResult result) {
        return switch (result.getFlow()) {
            case CREATE -> eventService.create(userId, result.text(FlowStep.NAME), result.date(FlowStep.DATE),
                            result.time(FlowStep.TIME), result.text(FlowStep.DETAILS))
                    .flatMap(event -> done(userId, messageBuilder.buildEventCreatedMessage(event)));
            case EDIT -> eventService.updateDetails(result.id(FlowStep.EVENT_ID), userId, result.text(FlowStep.NEW_DETAILS))
                    .flatMap(event -> done(userId, messageBuilder.buildEventUpdatedMessage(event.getId())))
                    .onErrorResume(this::isForeignOrMissingEvent, error -> done(userId, messageBuilder.buildEventNotFoundMessage()));
            case DELETE -> eventService.delete(result.id(FlowStep.EVENT_ID), userId)
                    .then(done(userId, messageBuilder.buildEventDeletedMessage(result.id(FlowStep.EVENT_ID))))
                    .onErrorResume(this::isForeignOrMissingEvent, error -> done(userId, messageBuilder.buildEventNotFoundMessage()));
            case SHARE -> eventService.setVisibility(result.id(FlowStep.EVENT_ID), userId, result.flag(FlowStep.VISIBILITY))
                    .flatMap(event -> done(userId, messageBuilder.buildVisibilityMessage(event)))
                    .onErrorResume(this::isForeignOrMissingEvent, error -> done(userId, messageBuilder.buildEventNotFoundMessage()));
            case INVITE -> appointmentService.inviteToEvent(userId, result.id(FlowStep.PARTICIPANT_ID),
                            result.id(FlowStep.EVENT_ID), result.text(FlowStep.DETAILS_OR_SKIP))
                    .flatMap(appointment -> {
                        notificationService.notifyInvitation(appointment);
                        return done(userId, messageBuilder.buildInviteSentMessage(appointment));
                    })
                    .onErrorResume(this::isForeignOrMissingEvent, error -> done(userId, messageBuilder.buildEventNotFoundMessage()))
                    .onErrorResume(error -> !(error instanceof StorageUnavailableException)
                                    && !(error instanceof SlotContentionException)
                                    && !(error instanceof ConversationInputException),
                            error -> done(userId, messageBuilder.buildErrorMessage(error)));
            case NONE -> Mono.empty();
        };
    }

    private boolean isForeignOrMissingEvent(Throwable error) {
        return error instanceof EventNotFoundException || error instanceof NotOwnerException;
    }

    private Mono<Void> done(Long userId, String text) {
        return telegramMessageService.sendMessage(userId, text, keyboardFactory.removeKeyboard());
    }

    private Mono<Void> prompt(Long userId, FlowStep step) {
        return telegramMessageService.sendMessage(userId, step.getPrompt(), keyboardFor(step));
    }

    private ReplyKeyboard keyboardFor(FlowStep step) {
        return switch (step.getInputType()) {
            case OPTIONAL_TEXT -> keyboardFactory.skipKeyboard();
            case VISIBILITY -> keyboardFactory.yesNoKeyboard();
            default -> keyboardFactory.cancelKeyboard();
        };
    }
}
