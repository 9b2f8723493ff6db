package ru.oparin.calendar.mapper;

import org.springframework.stereotype.Component;
import ru.oparin.calendar.model.dto.EventDTO;
import ru.oparin.calendar.model.entity.Event;

/**
 * Маппер для преобразования событий в DTO.
 */
@Component
public class EventMapper {

    public EventDTO toDTO(Event event) {
        return EventDTO.builder()
                .id(event.getId())
                .name(event.getTitle())
                .date(event.getDate())
                .time(event.getTime())
                .details(event.getDetails())
                .tgUserId(event.getOwnerId())
                .isPublic(Boolean.TRUE.equals(event.getIsPublic()))
                .build();
    }
}
