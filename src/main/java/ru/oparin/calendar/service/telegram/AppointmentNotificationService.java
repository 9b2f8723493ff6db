package ru.oparin.calendar.service.telegram;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.calendar.model.entity.Appointment;
import ru.oparin.calendar.service.AppointmentService;

/**
 * Уведомления сторон встречи.
 * Публичные методы не ждут доставки: отправка запускается в фоне и не задерживает ответ пользователю.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentNotificationService {

    private final TelegramMessageService telegramMessageService;
    private final TelegramKeyboardFactory keyboardFactory;
    private final TelegramBotMessageBuilder messageBuilder;
    private final AppointmentService appointmentService;

    /**
     * Отправить участнику приглашение с кнопками ответа.
     * Если доставить не удалось, приглашение отменяется от имени организатора, чтобы не занимать слот.
     */
    public void notifyInvitation(Appointment appointment) {
        deliverInvitation(appointment)
                .subscribe(null, error -> log.error("Сбой обработки доставки приглашения #{}", appointment.getId(), error));
    }

    public void notifyResponse(Appointment appointment) {
        send(appointment.getOrganizerId(), messageBuilder.buildResponseNotificationMessage(appointment))
                .subscribe(null, error -> log.warn("Не удалось уведомить организатора {} об ответе на встречу #{}",
                        appointment.getOrganizerId(), appointment.getId()));
    }

    public void notifyCancelled(Appointment appointment, Long cancelledBy) {
        Long recipient = appointment.counterpartOf(cancelledBy);
        send(recipient, messageBuilder.buildCancelNotificationMessage(appointment, cancelledBy))
                .subscribe(null, error -> log.warn("Не удалось уведомить пользователя {} об отмене встречи #{}",
                        recipient, appointment.getId()));
    }

    Mono<Void> deliverInvitation(Appointment appointment) {
        return telegramMessageService.sendMessage(appointment.getParticipantId(),
                        messageBuilder.buildInvitationMessage(appointment),
                        keyboardFactory.invitationButtons(appointment.getId()))
                .doOnSuccess(v -> log.info("Приглашение #{} доставлено пользователю {}",
                        appointment.getId(), appointment.getParticipantId()))
                .onErrorResume(error -> {
                    log.warn("Приглашение #{} не доставлено пользователю {}: {}",
                            appointment.getId(), appointment.getParticipantId(), error.getMessage());
                    return appointmentService.cancel(appointment.getId(), appointment.getOrganizerId())
                            .then(send(appointment.getOrganizerId(),
                                    messageBuilder.buildInvitationUndeliveredMessage(appointment)));
                });
    }

    private Mono<Void> send(Long userId, String text) {
        return telegramMessageService.sendMessage(userId, text);
    }
}
