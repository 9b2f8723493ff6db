package ru.oparin.calendar.service.telegram;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.calendar.config.properties.TelegramBotProperties;
import ru.oparin.calendar.exception.CalendarException;
import ru.oparin.calendar.exception.ConversationInputException;
import ru.oparin.calendar.model.dto.telegram.TelegramMessage;
import ru.oparin.calendar.model.dto.telegram.TelegramUpdate;
import ru.oparin.calendar.model.dto.telegram.TelegramUser;
import ru.oparin.calendar.service.AppointmentService;
import ru.oparin.calendar.service.EventService;
import ru.oparin.calendar.service.ExportService;
import ru.oparin.calendar.service.UserService;
import ru.oparin.calendar.service.conversation.ConversationEngine;
import ru.oparin.calendar.service.conversation.FlowType;
import ru.oparin.calendar.service.conversation.StepInputParser;
import ru.oparin.calendar.service.conversation.StepInputType;
import ru.oparin.calendar.service.conversation.UserUpdateSerializer;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Основной сервис для работы с Telegram ботом.
 * Обрабатывает команды и сообщения от пользователей.
 */
@RequiredArgsConstructor
@Service
@Slf4j
public class TelegramBotService {

    private final UserService userService;
    private final EventService eventService;
    private final AppointmentService appointmentService;
    private final ExportService exportService;
    private final TelegramConversationHandler conversationHandler;
    private final TelegramBotCallbackHandler callbackHandler;
    private final AppointmentNotificationService notificationService;
    private final TelegramMessageService telegramMessageService;
    private final TelegramBotMessageBuilder messageBuilder;
    private final UserUpdateSerializer userUpdateSerializer;
    private final Clock clock;
    private final TelegramBotProperties telegramBotProperties;

    /**
     * Обработать обновление от Telegram.
     * Обновления одного пользователя обрабатываются строго по очереди.
     */
    public Mono<Void> processUpdate(TelegramUpdate update) {
        Long userId = update.senderId();
        if (userId == null) {
            log.debug("Обновление {} не содержит отправителя, пропускаем", update.getUpdateId());
            return Mono.empty();
        }
        return userUpdateSerializer.serialize(userId, () -> route(update));
    }

    private Mono<Void> route(TelegramUpdate update) {
        if (update.getCallbackQuery() != null) {
            return callbackHandler.handleCallbackQuery(update.getCallbackQuery());
        }

        TelegramMessage message = update.getMessage();
        if (message == null || message.getText() == null) {
            log.debug("Обновление {} не содержит текстового сообщения, пропускаем", update.getUpdateId());
            return Mono.empty();
        }

        TelegramUser from = message.getFrom();
        Long userId = from.getId();
        log.debug("Сообщение от пользователя {}: {}", userId, message.getText());

        return processMessage(from, message.getText().trim())
                .onErrorResume(error -> {
                    if (error instanceof CalendarException) {
                        log.warn("Запрос пользователя {} отклонён: {}", userId, error.getMessage());
                    } else {
                        log.error("Ошибка обработки сообщения от пользователя {}: {}", userId, error.getMessage(), error);
                    }
                    return telegramMessageService.sendMessage(userId, messageBuilder.buildErrorMessage(error))
                            .onErrorResume(sendError -> {
                                log.warn("Не удалось отправить сообщение об ошибке пользователю {}: {}",
                                        userId, sendError.getMessage());
                                return Mono.empty();
                            });
                });
    }

    private Mono<Void> processMessage(TelegramUser from, String text) {
        Long userId = from.getId();
        if (ConversationEngine.isCancelWord(text)) {
            return conversationHandler.cancel(userId);
        }
        if (text.startsWith("/")) {
            return handleCommand(from, text);
        }
        if (conversationHandler.hasActiveFlow(userId)) {
            return conversationHandler.handleInput(userId, text);
        }
        return reply(userId, messageBuilder.buildUnknownCommandMessage());
    }

    private Mono<Void> handleCommand(TelegramUser from, String text) {
        String[] parts = text.split("\\s+", 2);
        Long userId = from.getId();
        if (!isAddressedToThisBot(parts[0])) {
            log.debug("Команда {} от пользователя {} адресована другому боту, пропускаем", parts[0], userId);
            return Mono.empty();
        }
        String command = stripBotName(parts[0]).toLowerCase(Locale.ROOT);
        String args = parts.length > 1 ? parts[1].trim() : "";
        log.info("Команда {} от пользователя {}", command, userId);

        return switch (command) {
            case "/start" -> reply(userId, messageBuilder.buildWelcomeMessage(from.getFirstName()));
            case "/help" -> reply(userId, messageBuilder.buildHelpMessage());
            case "/register" -> userService.register(from)
                    .then(reply(userId, messageBuilder.buildRegisteredMessage()));
            case "/create_event" -> registered(userId, () -> conversationHandler.startFlow(userId, FlowType.CREATE));
            case "/display_events" -> registered(userId, () -> handleDisplayEvents(userId));
            case "/read_event" -> registered(userId, () -> handleReadEvent(userId, args));
            case "/edit_event" -> registered(userId, () -> args.isEmpty()
                    ? conversationHandler.startFlow(userId, FlowType.EDIT)
                    : handleInlineEdit(userId, args));
            case "/delete_event" -> registered(userId, () -> args.isEmpty()
                    ? conversationHandler.startFlow(userId, FlowType.DELETE)
                    : handleInlineDelete(userId, args));
            case "/share" -> registered(userId, () -> conversationHandler.startFlow(userId, FlowType.SHARE));
            case "/invite" -> registered(userId, () -> conversationHandler.startFlow(userId, FlowType.INVITE));
            case "/appointments" -> registered(userId, () -> handleAppointments(userId));
            case "/cancel_meeting" -> registered(userId, () -> handleCancelMeeting(userId, args));
            case "/busy" -> registered(userId, () -> handleBusy(userId, args));
            case "/export" -> registered(userId, () -> handleExport(userId));
            default -> reply(userId, messageBuilder.buildUnknownCommandMessage());
        };
    }

    /**
     * Выполнить действие только для зарегистрированного пользователя.
     */
    private Mono<Void> registered(Long userId, Supplier<Mono<Void>> action) {
        return userService.requireRegistered(userId).then(Mono.defer(action));
    }

    private Mono<Void> handleDisplayEvents(Long userId) {
        return eventService.listByOwner(userId)
                .collectList()
                .flatMap(events -> reply(userId, messageBuilder.buildEventListMessage(events)));
    }

    private Mono<Void> handleReadEvent(Long userId, String args) {
        return Mono.defer(() -> {
            Long eventId = (Long) StepInputParser.parse(StepInputType.POSITIVE_ID, args);
            return eventService.getOwned(eventId, userId)
                    .flatMap(event -> reply(userId, messageBuilder.buildEventDetailsMessage(event)));
        }).onErrorResume(ConversationInputException.class,
                error -> reply(userId, messageBuilder.buildUsageMessage("/read_event <id>")));
    }

    private Mono<Void> handleInlineEdit(Long userId, String args) {
        String[] parts = args.split("\\s+", 2);
        if (parts.length < 2) {
            return reply(userId, messageBuilder.buildUsageMessage("/edit_event <id> <новое описание>"));
        }
        return Mono.defer(() -> {
            Long eventId = (Long) StepInputParser.parse(StepInputType.POSITIVE_ID, parts[0]);
            return eventService.updateDetails(eventId, userId, parts[1].trim())
                    .flatMap(event -> reply(userId, messageBuilder.buildEventUpdatedMessage(event.getId())));
        }).onErrorResume(ConversationInputException.class,
                error -> reply(userId, messageBuilder.buildUsageMessage("/edit_event <id> <новое описание>")));
    }

    private Mono<Void> handleInlineDelete(Long userId, String args) {
        return Mono.defer(() -> {
            Long eventId = (Long) StepInputParser.parse(StepInputType.POSITIVE_ID, args);
            return eventService.delete(eventId, userId)
                    .then(reply(userId, messageBuilder.buildEventDeletedMessage(eventId)));
        }).onErrorResume(ConversationInputException.class,
                error -> reply(userId, messageBuilder.buildUsageMessage("/delete_event <id>")));
    }

    private Mono<Void> handleAppointments(Long userId) {
        return appointmentService.findForIdentity(userId)
                .collectList()
                .flatMap(appointments -> reply(userId, messageBuilder.buildAppointmentListMessage(userId, appointments)));
    }

    private Mono<Void> handleCancelMeeting(Long userId, String args) {
        return Mono.defer(() -> {
            Long appointmentId = (Long) StepInputParser.parse(StepInputType.POSITIVE_ID, args);
            return appointmentService.cancel(appointmentId, userId)
                    .flatMap(appointment -> {
                        notificationService.notifyCancelled(appointment, userId);
                        return reply(userId, messageBuilder.buildMeetingCancelledMessage(appointment));
                    });
        }).onErrorResume(ConversationInputException.class,
                error -> reply(userId, messageBuilder.buildUsageMessage("/cancel_meeting <id>")));
    }

    private Mono<Void> handleBusy(Long userId, String args) {
        return Mono.defer(() -> {
            LocalDate date = args.isEmpty()
                    ? LocalDate.now(clock)
                    : (LocalDate) StepInputParser.parse(StepInputType.DATE, args);
            return appointmentService.findBusySlots(userId, date, date)
                    .collectList()
                    .flatMap(slots -> reply(userId, messageBuilder.buildBusySlotsMessage(date, slots)));
        }).onErrorResume(ConversationInputException.class,
                error -> reply(userId, messageBuilder.buildUsageMessage("/busy [ГГГГ-ММ-ДД]")));
    }

    private Mono<Void> handleExport(Long userId) {
        return Mono.fromCallable(() -> exportService.issueLinks(userId))
                .flatMap(links -> reply(userId, messageBuilder.buildExportLinksMessage(links)));
    }

    private Mono<Void> reply(Long userId, String text) {
        return telegramMessageService.sendMessage(userId, text);
    }

    /**
     * Команда без суффикса @имя считается адресованной этому боту. Если имя бота не задано, принимается любой суффикс.
     */
    private boolean isAddressedToThisBot(String command) {
        int at = command.indexOf('@');
        String botName = telegramBotProperties.getUsername();
        if (at <= 0 || botName == null || botName.isBlank()) {
            return true;
        }
        return command.substring(at + 1).equalsIgnoreCase(botName.replaceFirst("^@", ""));
    }

    /**
     * В группах Telegram добавляет к команде имя бота: /help@calendar_bot.
     */
    private static String stripBotName(String command) {
        int at = command.indexOf('@');
        return at > 0 ? command.substring(0, at) : command;
    }
}
