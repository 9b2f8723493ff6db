package ru.oparin.calendar.model.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.calendar.model.enums.AppointmentStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Встреча (приглашение)")
public class AppointmentDTO {

    private Long id;

    @JsonProperty("event_id")
    private Long eventId;

    @JsonProperty("organizer_id")
    private Long organizerId;

    @JsonProperty("participant_id")
    private Long participantId;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate date;

    @JsonFormat(pattern = "HH:mm:ss")
    private LocalTime time;

    private String details;

    private AppointmentStatus status;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;
}
