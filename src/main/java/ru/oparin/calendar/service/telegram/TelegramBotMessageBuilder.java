package ru.oparin.calendar.service.telegram;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import ru.oparin.calendar.config.properties.ExportProperties;
import ru.oparin.calendar.exception.AppointmentNotFoundException;
import ru.oparin.calendar.exception.CalendarException;
import ru.oparin.calendar.exception.ConversationInputException;
import ru.oparin.calendar.exception.EventNotFoundException;
import ru.oparin.calendar.exception.InvalidTransitionException;
import ru.oparin.calendar.exception.NotOwnerException;
import ru.oparin.calendar.exception.NotParticipantException;
import ru.oparin.calendar.exception.SlotBusyException;
import ru.oparin.calendar.exception.SlotContentionException;
import ru.oparin.calendar.exception.StorageUnavailableException;
import ru.oparin.calendar.exception.UserNotRegisteredException;
import ru.oparin.calendar.model.dto.ExportLinksDTO;
import ru.oparin.calendar.model.entity.Appointment;
import ru.oparin.calendar.model.entity.Event;
import ru.oparin.calendar.service.conversation.FlowType;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Класс для построения текстовых сообщений для Telegram бота.
 */
@Component
@RequiredArgsConstructor
public class TelegramBotMessageBuilder {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final ExportProperties exportProperties;

    public String buildWelcomeMessage(String firstName) {
        return String.format("""
                👋 Привет, %s!

                Я календарный бот: храню ваши события и помогаю договориться о встречах.
                Для начала зарегистрируйтесь: /register
                Список команд: /help
                """, firstName != null ? firstName : "друг");
    }

    public String buildHelpMessage() {
        return """
                📅 Команды бота

                /register - регистрация
                /create_event - создать событие
                /display_events - мои события
                /read_event <id> - подробности события
                /edit_event - изменить описание (или /edit_event <id> <текст>)
                /delete_event - удалить событие (или /delete_event <id>)
                /share - сделать событие публичным или приватным
                /invite - пригласить пользователя на встречу
                /appointments - мои встречи
                /cancel_meeting <id> - отменить встречу
                /busy [ГГГГ-ММ-ДД] - занятые слоты на дату
                /export - ссылки на выгрузку событий
                /cancel или «Отмена» - прервать текущее действие
                """;
    }

    public String buildRegisteredMessage() {
        return "✅ Вы зарегистрированы. Создайте первое событие: /create_event";
    }

    public String buildUnknownCommandMessage() {
        return "Команда не распознана. Используйте /help.";
    }

    public String buildCancelledMessage(boolean hadFlow) {
        return hadFlow ? "Действие отменено." : "Нет активного действия.";
    }

    public String buildFlowReplacedMessage(FlowType replaced) {
        return "⚠️ Незавершённое действие «" + replaced.getDisplayName() + "» прервано.";
    }

    public String buildEventCreatedMessage(Event event) {
        return String.format("✅ Событие создано! ID: %d%n%s", event.getId(), formatEvent(event));
    }

    public String buildEventUpdatedMessage(Long eventId) {
        return "✅ Описание события #" + eventId + " обновлено.";
    }

    public String buildEventDeletedMessage(Long eventId) {
        return "🗑 Событие #" + eventId + " удалено.";
    }

    public String buildVisibilityMessage(Event event) {
        return Boolean.TRUE.equals(event.getIsPublic())
                ? "🌐 Событие #" + event.getId() + " теперь публичное."
                : "🔒 Событие #" + event.getId() + " теперь приватное.";
    }

    public String buildEventListMessage(List<Event> events) {
        if (events.isEmpty()) {
            return "У вас пока нет событий. Создайте: /create_event";
        }
        StringBuilder text = new StringBuilder("📅 Ваши события:\n");
        for (Event event : events) {
            text.append(String.format("%n#%d %s %s %s%s", event.getId(), event.getDate(),
                    event.getTime().format(TIME_FORMAT), event.getTitle(),
                    Boolean.TRUE.equals(event.getIsPublic()) ? " 🌐" : ""));
        }
        return text.toString();
    }

    public String buildEventDetailsMessage(Event event) {
        return String.format("📌 Событие #%d%n%s", event.getId(), formatEvent(event));
    }

    public String buildEventNotFoundMessage() {
        return "Событие не найдено.";
    }

    public String buildInviteSentMessage(Appointment appointment) {
        return String.format("📨 Приглашение #%d отправлено пользователю %d на %s %s.",
                appointment.getId(), appointment.getParticipantId(),
                appointment.getDate(), appointment.getTime().format(TIME_FORMAT));
    }

    public String buildInvitationMessage(Appointment appointment) {
        return String.format("""
                📨 Приглашение на встречу #%d
                От пользователя: %d
                Когда: %s %s
                Описание: %s
                """, appointment.getId(), appointment.getOrganizerId(), appointment.getDate(),
                appointment.getTime().format(TIME_FORMAT), emptyAsDash(appointment.getDetails()));
    }

    public String buildInvitationUndeliveredMessage(Appointment appointment) {
        return String.format("⚠️ Не удалось доставить приглашение #%d пользователю %d. Приглашение отменено.",
                appointment.getId(), appointment.getParticipantId());
    }

    public String buildResponseSavedMessage(Appointment appointment) {
        return String.format("Вы ответили на приглашение #%d: %s.",
                appointment.getId(), appointment.getStatus().getDisplayName());
    }

    public String buildResponseNotificationMessage(Appointment appointment) {
        return String.format("🔔 Пользователь %d ответил на приглашение #%d (%s %s): %s.",
                appointment.getParticipantId(), appointment.getId(), appointment.getDate(),
                appointment.getTime().format(TIME_FORMAT), appointment.getStatus().getDisplayName());
    }

    public String buildMeetingCancelledMessage(Appointment appointment) {
        return "Встреча #" + appointment.getId() + " отменена.";
    }

    public String buildCancelNotificationMessage(Appointment appointment, Long cancelledBy) {
        return String.format("🔔 Пользователь %d отменил встречу #%d (%s %s).",
                cancelledBy, appointment.getId(), appointment.getDate(), appointment.getTime().format(TIME_FORMAT));
    }

    public String buildAppointmentListMessage(Long userId, List<Appointment> appointments) {
        if (appointments.isEmpty()) {
            return "У вас нет встреч.";
        }
        StringBuilder text = new StringBuilder("🤝 Ваши встречи:\n");
        for (Appointment appointment : appointments) {
            boolean organizer = userId.equals(appointment.getOrganizerId());
            text.append(String.format("%n#%d %s %s, %s %d: %s", appointment.getId(), appointment.getDate(),
                    appointment.getTime().format(TIME_FORMAT),
                    organizer ? "участник" : "организатор",
                    appointment.counterpartOf(userId),
                    appointment.getStatus().getDisplayName()));
        }
        return text.toString();
    }

    public String buildBusySlotsMessage(LocalDate date, List<Appointment> appointments) {
        if (appointments.isEmpty()) {
            return "На " + date + " занятых слотов нет.";
        }
        StringBuilder text = new StringBuilder("⏰ Занятые слоты на " + date + ":\n");
        for (Appointment appointment : appointments) {
            text.append(String.format("%n%s встреча #%d (%s)", appointment.getTime().format(TIME_FORMAT),
                    appointment.getId(), appointment.getStatus().getDisplayName()));
        }
        return text.toString();
    }

    public String buildExportLinksMessage(ExportLinksDTO links) {
        return String.format("""
                📤 Ссылки на выгрузку ваших событий (действуют %d мин.):

                JSON: %s
                CSV: %s
                """, Math.max(1, exportProperties.getMaxAge().toMinutes()), links.getJsonUrl(), links.getCsvUrl());
    }

    public String buildUsageMessage(String usage) {
        return "Использование: " + usage;
    }

    public String buildTemporaryUnavailableMessage() {
        return "⏳ Сервис временно недоступен. Повторите последнее сообщение чуть позже, введённые данные сохранены.";
    }

    public String buildRetryLaterMessage() {
        return "⏳ Не удалось сохранить приглашение из-за одновременных изменений. Отправьте последнее сообщение ещё раз.";
    }

    public String buildErrorMessage() {
        return "❌ Произошла ошибка. Попробуйте позже.";
    }

    /**
     * Текст для пользователя по прикладной ошибке. Сообщения не раскрывают чужие данные.
     */
    public String buildErrorMessage(Throwable error) {
        if (error instanceof ConversationInputException) {
            return error.getMessage();
        }
        if (error instanceof UserNotRegisteredException) {
            return "Сначала зарегистрируйтесь: /register";
        }
        if (error instanceof EventNotFoundException || error instanceof NotOwnerException) {
            return buildEventNotFoundMessage();
        }
        if (error instanceof AppointmentNotFoundException || error instanceof NotParticipantException) {
            return "Встреча не найдена.";
        }
        if (error instanceof SlotBusyException busy) {
            return String.format("⛔ Пользователь %d уже занят %s в %s. Приглашение не создано.",
                    busy.getParticipantId(), busy.getDate(), busy.getTime().format(TIME_FORMAT));
        }
        if (error instanceof InvalidTransitionException transition) {
            return "Текущий статус встречи: " + transition.getCurrentStatus().getDisplayName() + ".";
        }
        if (error instanceof SlotContentionException) {
            return buildRetryLaterMessage();
        }
        if (error instanceof StorageUnavailableException) {
            return "⏳ Сервис временно недоступен. Попробуйте позже.";
        }
        if (error instanceof CalendarException) {
            return error.getMessage();
        }
        return buildErrorMessage();
    }

    private String formatEvent(Event event) {
        return String.format("""
                Название: %s
                Дата: %s
                Время: %s
                Описание: %s
                Публичное: %s""", event.getTitle(), event.getDate(), event.getTime().format(TIME_FORMAT),
                emptyAsDash(event.getDetails()), Boolean.TRUE.equals(event.getIsPublic()) ? "да" : "нет");
    }

    private static String emptyAsDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}
