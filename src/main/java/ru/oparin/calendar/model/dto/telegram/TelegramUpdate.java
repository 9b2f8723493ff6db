package ru.oparin.calendar.model.dto.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * DTO для обновления от Telegram Bot API.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramUpdate {

    @JsonProperty("update_id")
    private Long updateId;

    private TelegramMessage message;

    @JsonProperty("callback_query")
    private TelegramCallbackQuery callbackQuery;

    /**
     * ID пользователя, от которого пришло обновление, или null для служебных обновлений.
     */
    public Long senderId() {
        if (callbackQuery != null && callbackQuery.getFrom() != null) {
            return callbackQuery.getFrom().getId();
        }
        if (message != null && message.getFrom() != null) {
            return message.getFrom().getId();
        }
        return null;
    }
}
