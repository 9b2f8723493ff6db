package ru.oparin.calendar.service.telegram;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import ru.oparin.calendar.exception.CalendarException;
import ru.oparin.calendar.model.dto.telegram.TelegramCallbackQuery;
import ru.oparin.calendar.model.enums.AppointmentDecision;
import ru.oparin.calendar.service.AppointmentService;

import java.util.Optional;

/**
 * Обработчик callback queries от inline-кнопок приглашений.
 */
@RequiredArgsConstructor
@Component
@Slf4j
public class TelegramBotCallbackHandler {

    private final TelegramMessageService telegramMessageService;
    private final TelegramBotMessageBuilder messageBuilder;
    private final AppointmentService appointmentService;
    private final AppointmentNotificationService notificationService;

    /**
     * Обработать нажатие кнопки. На callback query отвечаем всегда, даже при ошибке.
     */
    public Mono<Void> handleCallbackQuery(TelegramCallbackQuery callbackQuery) {
        if (callbackQuery.getFrom() == null) {
            log.warn("Callback query {} без отправителя, пропускаем", callbackQuery.getId());
            return telegramMessageService.answerCallbackQuery(callbackQuery.getId(), null);
        }
        log.info("Обработка callback query {} от пользователя {}: {}",
                callbackQuery.getId(), callbackQuery.getFrom().getId(), callbackQuery.getData());

        String data = callbackQuery.getData();
        if (data != null && data.startsWith(TelegramKeyboardFactory.APPOINTMENT_CALLBACK_PREFIX)) {
            return handleAppointmentCallback(callbackQuery, data);
        }

        return telegramMessageService.answerCallbackQuery(callbackQuery.getId(), null);
    }

    /**
     * Обработать ответ на приглашение: appt:ok:&lt;id&gt; или appt:no:&lt;id&gt;.
     */
    private Mono<Void> handleAppointmentCallback(TelegramCallbackQuery callbackQuery, String data) {
        String[] parts = data.split(":");
        Optional<AppointmentDecision> decision = parts.length == 3
                ? AppointmentDecision.fromCallbackCode(parts[1])
                : Optional.empty();
        Long appointmentId = parts.length == 3 ? parseId(parts[2]) : null;
        if (decision.isEmpty() || appointmentId == null) {
            log.warn("Некорректные данные callback: {}", data);
            return telegramMessageService.answerCallbackQuery(callbackQuery.getId(), "Некорректная кнопка");
        }

        Long userId = callbackQuery.getFrom().getId();
        return appointmentService.respond(appointmentId, userId, decision.get())
                .flatMap(appointment -> {
                    notificationService.notifyResponse(appointment);
                    return telegramMessageService.answerCallbackQuery(callbackQuery.getId(), "Ответ сохранён")
                            .then(removeButtons(callbackQuery))
                            .then(telegramMessageService.sendMessage(userId, messageBuilder.buildResponseSavedMessage(appointment)));
                })
                .onErrorResume(CalendarException.class, error -> {
                    log.info("Ответ пользователя {} на встречу #{} отклонён: {}", userId, appointmentId, error.getMessage());
                    return telegramMessageService.answerCallbackQuery(callbackQuery.getId(),
                            messageBuilder.buildErrorMessage(error));
                });
    }

    private Mono<Void> removeButtons(TelegramCallbackQuery callbackQuery) {
        if (callbackQuery.getMessage() == null || callbackQuery.getMessage().getChat() == null) {
            return Mono.empty();
        }
        return telegramMessageService.removeInlineKeyboard(
                        callbackQuery.getMessage().getChat().getId(), callbackQuery.getMessage().getMessageId())
                .onErrorResume(error -> {
                    log.warn("Не удалось убрать кнопки у сообщения {}: {}",
                            callbackQuery.getMessage().getMessageId(), error.getMessage());
                    return Mono.empty();
                });
    }

    private static Long parseId(String value) {
        try {
            long id = Long.parseLong(value);
            return id > 0 ? id : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
