package ru.oparin.calendar.model.dto.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * DTO для callback query (нажатие inline-кнопки).
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramCallbackQuery {

    private String id;

    private TelegramUser from;

    private TelegramMessage message;

    private String data;
}
