package ru.oparin.calendar.service.telegram;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.calendar.config.properties.ExportProperties;
import ru.oparin.calendar.model.entity.Appointment;
import ru.oparin.calendar.model.enums.AppointmentStatus;
import ru.oparin.calendar.service.AppointmentService;

import java.time.LocalDate;
import java.time.LocalTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AppointmentNotificationServiceTest {

    @Mock
    private TelegramMessageService telegramMessageService;

    @Mock
    private AppointmentService appointmentService;

    private AppointmentNotificationService notificationService;

    @BeforeEach
    void setUp() {
        ExportProperties exportProperties = new ExportProperties();
        exportProperties.setSecret("secret");
        notificationService = new AppointmentNotificationService(telegramMessageService,
                new TelegramKeyboardFactory(new ObjectMapper()), new TelegramBotMessageBuilder(exportProperties),
                appointmentService);
    }

    @Test
    void invitationCarriesConfirmAndDeclineButtons() {
        // Given
        when(telegramMessageService.sendMessage(eq(2L), anyString(), any(ReplyKeyboard.class))).thenReturn(Mono.empty());

        // When
        StepVerifier.create(notificationService.deliverInvitation(appointment())).verifyComplete();

        // Then
        verify(telegramMessageService).sendMessage(eq(2L), anyString(), argThat(keyboard ->
                keyboard instanceof InlineKeyboardMarkup markup
                        && "appt:ok:100".equals(markup.getKeyboard().get(0).get(0).getCallbackData())
                        && "appt:no:100".equals(markup.getKeyboard().get(0).get(1).getCallbackData())));
        verify(appointmentService, never()).cancel(anyLong(), anyLong());
    }

    @Test
    void undeliveredInvitationIsCancelledAndOrganizerInformed() {
        // Given
        Appointment appointment = appointment();
        when(telegramMessageService.sendMessage(eq(2L), anyString(), any(ReplyKeyboard.class)))
                .thenReturn(Mono.error(new IllegalStateException("Forbidden: bot was blocked by the user")));
        when(appointmentService.cancel(100L, 1L))
                .thenReturn(Mono.just(appointment.toBuilder().status(AppointmentStatus.CANCELLED).build()));
        when(telegramMessageService.sendMessage(eq(1L), anyString())).thenReturn(Mono.empty());

        // When
        StepVerifier.create(notificationService.deliverInvitation(appointment)).verifyComplete();

        // Then
        verify(appointmentService).cancel(100L, 1L);
        verify(telegramMessageService).sendMessage(eq(1L), anyString());
    }

    @Test
    void responseNotificationGoesToOrganizer() {
        when(telegramMessageService.sendMessage(eq(1L), anyString())).thenReturn(Mono.empty());

        notificationService.notifyResponse(appointment().toBuilder().status(AppointmentStatus.CONFIRMED).build());

        verify(telegramMessageService).sendMessage(eq(1L), anyString());
    }

    @Test
    void cancelNotificationGoesToOtherSide() {
        when(telegramMessageService.sendMessage(eq(1L), anyString())).thenReturn(Mono.empty());

        notificationService.notifyCancelled(appointment().toBuilder().status(AppointmentStatus.CANCELLED).build(), 2L);

        verify(telegramMessageService).sendMessage(eq(1L), anyString());
    }

    private static Appointment appointment() {
        return Appointment.builder().id(100L).eventId(10L).organizerId(1L).participantId(2L)
                .date(LocalDate.of(2025, 12, 12)).time(LocalTime.NOON).details("Обсудить план")
                .status(AppointmentStatus.PENDING).build();
    }
}
