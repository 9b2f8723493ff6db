package ru.oparin.calendar.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import ru.oparin.calendar.mapper.EventMapper;
import ru.oparin.calendar.model.dto.EventDTO;
import ru.oparin.calendar.service.EventService;

@RestController
@RequestMapping("/api/public")
@RequiredArgsConstructor
@Tag(name = "Публичные события", description = "События, которые владельцы отметили как публичные")
public class PublicEventController {

    private final EventService eventService;
    private final EventMapper eventMapper;

    /**
     * Публичные события владельца. Нечисловой owner даёт пустой список.
     */
    @GetMapping("/events")
    @Operation(summary = "Публичные события владельца")
    public Flux<EventDTO> publicEvents(@RequestParam(name = "owner", required = false) String owner) {
        if (owner == null || !owner.trim().matches("\\d{1,18}")) {
            return Flux.empty();
        }
        return eventService.listPublic(Long.parseLong(owner.trim()))
                .map(eventMapper::toDTO);
    }
}
