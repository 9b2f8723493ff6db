package ru.oparin.calendar.service.telegram;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardRemove;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardRow;
import ru.oparin.calendar.model.enums.AppointmentDecision;
import ru.oparin.calendar.service.conversation.StepInputParser;

import java.util.List;

/**
 * Клавиатуры бота и их сериализация в reply_markup.
 */
@Component
public class TelegramKeyboardFactory {

    public static final String APPOINTMENT_CALLBACK_PREFIX = "appt:";
    public static final String CANCEL_BUTTON = "Отмена";

    private final ObjectMapper objectMapper;

    public TelegramKeyboardFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Кнопки подтверждения и отказа для приглашения.
     * callback_data: appt:ok:&lt;id&gt; и appt:no:&lt;id&gt;.
     */
    public InlineKeyboardMarkup invitationButtons(Long appointmentId) {
        return InlineKeyboardMarkup.builder()
                .keyboardRow(List.of(
                        InlineKeyboardButton.builder()
                                .text("✅ Подтвердить")
                                .callbackData(callbackData(AppointmentDecision.CONFIRM, appointmentId))
                                .build(),
                        InlineKeyboardButton.builder()
                                .text("❌ Отклонить")
                                .callbackData(callbackData(AppointmentDecision.DECLINE, appointmentId))
                                .build()))
                .build();
    }

    public InlineKeyboardMarkup emptyInlineKeyboard() {
        return InlineKeyboardMarkup.builder().build();
    }

    public ReplyKeyboardMarkup cancelKeyboard() {
        return replyKeyboard(CANCEL_BUTTON);
    }

    public ReplyKeyboardMarkup skipKeyboard() {
        return replyKeyboard(StepInputParser.SKIP_MARKER, CANCEL_BUTTON);
    }

    public ReplyKeyboardMarkup yesNoKeyboard() {
        return replyKeyboard("да", "нет", CANCEL_BUTTON);
    }

    public ReplyKeyboardRemove removeKeyboard() {
        return ReplyKeyboardRemove.builder()
                .removeKeyboard(true)
                .build();
    }

    public String toJson(ReplyKeyboard keyboard) {
        try {
            return objectMapper.writeValueAsString(keyboard);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Не удалось сериализовать клавиатуру", e);
        }
    }

    static String callbackData(AppointmentDecision decision, Long appointmentId) {
        return APPOINTMENT_CALLBACK_PREFIX + decision.getCallbackCode() + ":" + appointmentId;
    }

    private ReplyKeyboardMarkup replyKeyboard(String... buttons) {
        KeyboardRow row = new KeyboardRow();
        for (String button : buttons) {
            row.add(button);
        }
        return ReplyKeyboardMarkup.builder()
                .keyboardRow(row)
                .resizeKeyboard(true)
                .oneTimeKeyboard(true)
                .build();
    }
}
