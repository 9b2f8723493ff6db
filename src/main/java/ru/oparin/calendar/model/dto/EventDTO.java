package ru.oparin.calendar.model.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Событие в выгрузке и в REST-ответах.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Событие календаря")
public class EventDTO {

    private Long id;

    @Schema(description = "Название события")
    private String name;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate date;

    @JsonFormat(pattern = "HH:mm:ss")
    private LocalTime time;

    private String details;

    @JsonProperty("tg_user_id")
    @Schema(description = "ID владельца в Telegram")
    private Long tgUserId;

    @JsonProperty("is_public")
    private Boolean isPublic;
}
