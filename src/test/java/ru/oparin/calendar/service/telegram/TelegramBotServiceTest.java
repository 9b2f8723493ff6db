package ru.oparin.calendar.service.telegram;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.calendar.config.properties.ExportProperties;
import ru.oparin.calendar.config.properties.TelegramBotProperties;
import ru.oparin.calendar.exception.UserNotRegisteredException;
import ru.oparin.calendar.model.dto.telegram.TelegramCallbackQuery;
import ru.oparin.calendar.model.dto.telegram.TelegramMessage;
import ru.oparin.calendar.model.dto.telegram.TelegramUpdate;
import ru.oparin.calendar.model.dto.telegram.TelegramUser;
import ru.oparin.calendar.service.AppointmentService;
import ru.oparin.calendar.service.EventService;
import ru.oparin.calendar.service.ExportService;
import ru.oparin.calendar.service.UserService;
import ru.oparin.calendar.service.conversation.FlowType;
import ru.oparin.calendar.service.conversation.UserUpdateSerializer;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TelegramBotServiceTest {

    private static final Long USER = 1L;

    @Mock
    private UserService userService;

    @Mock
    private EventService eventService;

    @Mock
    private AppointmentService appointmentService;

    @Mock
    private ExportService exportService;

    @Mock
    private TelegramConversationHandler conversationHandler;

    @Mock
    private TelegramBotCallbackHandler callbackHandler;

    @Mock
    private AppointmentNotificationService notificationService;

    @Mock
    private TelegramMessageService telegramMessageService;

    private TelegramBotService telegramBotService;

    @BeforeEach
    void setUp() {
        ExportProperties exportProperties = new ExportProperties();
        exportProperties.setSecret("secret");
        TelegramBotProperties botProperties = new TelegramBotProperties();
        botProperties.setUsername("calendar_bot");
        telegramBotService = new TelegramBotService(userService, eventService, appointmentService, exportService,
                conversationHandler, callbackHandler, notificationService, telegramMessageService,
                new TelegramBotMessageBuilder(exportProperties), new UserUpdateSerializer(),
                Clock.fixed(Instant.parse("2025-11-03T08:00:00Z"), ZoneOffset.UTC), botProperties);
    }

    @Test
    void plainTextWithoutDialogIsUnknownCommand() {
        // Given
        when(conversationHandler.hasActiveFlow(USER)).thenReturn(false);
        when(telegramMessageService.sendMessage(USER, "Команда не распознана. Используйте /help.")).thenReturn(Mono.empty());

        // When / Then
        StepVerifier.create(telegramBotService.processUpdate(textUpdate("привет"))).verifyComplete();
        verify(telegramMessageService).sendMessage(USER, "Команда не распознана. Используйте /help.");
    }

    @Test
    void textInsideDialogGoesToConversation() {
        when(conversationHandler.hasActiveFlow(USER)).thenReturn(true);
        when(conversationHandler.handleInput(USER, "2025-12-12")).thenReturn(Mono.empty());

        StepVerifier.create(telegramBotService.processUpdate(textUpdate("2025-12-12"))).verifyComplete();

        verify(conversationHandler).handleInput(USER, "2025-12-12");
    }

    @Test
    void cancelWordResetsDialog() {
        when(conversationHandler.cancel(USER)).thenReturn(Mono.empty());

        StepVerifier.create(telegramBotService.processUpdate(textUpdate("Отмена"))).verifyComplete();

        verify(conversationHandler).cancel(USER);
        verify(conversationHandler, never()).handleInput(anyLong(), any());
    }

    @Test
    void unregisteredUserCannotStartDialog() {
        // Given
        when(userService.requireRegistered(USER)).thenReturn(Mono.error(new UserNotRegisteredException(USER)));
        when(telegramMessageService.sendMessage(eq(USER), contains("/register"))).thenReturn(Mono.empty());

        // When
        StepVerifier.create(telegramBotService.processUpdate(textUpdate("/create_event"))).verifyComplete();

        // Then
        verify(conversationHandler, never()).startFlow(anyLong(), any());
        verify(telegramMessageService).sendMessage(USER, "Сначала зарегистрируйтесь: /register");
    }

    @Test
    void registeredUserStartsCreateDialog() {
        when(userService.requireRegistered(USER)).thenReturn(Mono.empty());
        when(conversationHandler.startFlow(USER, FlowType.CREATE)).thenReturn(Mono.empty());

        StepVerifier.create(telegramBotService.processUpdate(textUpdate("/create_event@calendar_bot")))
                .verifyComplete();

        verify(conversationHandler).startFlow(USER, FlowType.CREATE);
    }

    @Test
    void commandForAnotherBotIsIgnored() {
        StepVerifier.create(telegramBotService.processUpdate(textUpdate("/create_event@other_bot"))).verifyComplete();

        verifyNoInteractions(userService, conversationHandler, telegramMessageService);
    }

    @Test
    void registerCommandStoresUser() {
        when(userService.register(any(TelegramUser.class))).thenReturn(Mono.empty());
        when(telegramMessageService.sendMessage(eq(USER), any())).thenReturn(Mono.empty());

        StepVerifier.create(telegramBotService.processUpdate(textUpdate("/register"))).verifyComplete();

        verify(userService).register(any(TelegramUser.class));
    }

    @Test
    void busyWithoutDateUsesToday() {
        LocalDate today = LocalDate.of(2025, 11, 3);
        when(userService.requireRegistered(USER)).thenReturn(Mono.empty());
        when(appointmentService.findBusySlots(USER, today, today)).thenReturn(Flux.empty());
        when(telegramMessageService.sendMessage(eq(USER), any())).thenReturn(Mono.empty());

        StepVerifier.create(telegramBotService.processUpdate(textUpdate("/busy"))).verifyComplete();

        verify(appointmentService).findBusySlots(USER, today, today);
    }

    @Test
    void badBusyDateShowsUsage() {
        when(userService.requireRegistered(USER)).thenReturn(Mono.empty());
        when(telegramMessageService.sendMessage(eq(USER), contains("/busy"))).thenReturn(Mono.empty());

        StepVerifier.create(telegramBotService.processUpdate(textUpdate("/busy 03.11.2025"))).verifyComplete();

        verifyNoInteractions(appointmentService);
    }

    @Test
    void callbackIsRoutedToCallbackHandler() {
        TelegramUser from = new TelegramUser();
        from.setId(2L);
        TelegramCallbackQuery query = new TelegramCallbackQuery();
        query.setId("cb-1");
        query.setFrom(from);
        query.setData("appt:ok:100");
        TelegramUpdate update = new TelegramUpdate();
        update.setUpdateId(7L);
        update.setCallbackQuery(query);
        when(callbackHandler.handleCallbackQuery(query)).thenReturn(Mono.empty());

        StepVerifier.create(telegramBotService.processUpdate(update)).verifyComplete();

        verify(callbackHandler).handleCallbackQuery(query);
    }

    @Test
    void updateWithoutSenderIsIgnored() {
        StepVerifier.create(telegramBotService.processUpdate(new TelegramUpdate())).verifyComplete();

        verifyNoInteractions(telegramMessageService, conversationHandler, callbackHandler);
    }

    private static TelegramUpdate textUpdate(String text) {
        TelegramUser from = new TelegramUser();
        from.setId(USER);
        from.setFirstName("Анна");
        TelegramMessage message = new TelegramMessage();
        message.setMessageId(1L);
        message.setFrom(from);
        message.setText(text);
        TelegramUpdate update = new TelegramUpdate();
        update.setUpdateId(1L);
        update.setMessage(message);
        return update;
    }
}
