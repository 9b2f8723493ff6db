package ru.oparin.calendar.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import ru.oparin.calendar.mapper.AppointmentMapper;
import ru.oparin.calendar.mapper.EventMapper;
import ru.oparin.calendar.model.dto.AppointmentDTO;
import ru.oparin.calendar.model.dto.EventDTO;
import ru.oparin.calendar.service.AppointmentService;
import ru.oparin.calendar.service.EventService;
import ru.oparin.calendar.util.SecurityUtil;

/**
 * Данные владельца экспортной ссылки.
 */
@RestController
@RequestMapping("/api/my")
@RequiredArgsConstructor
@Tag(name = "Мои данные", description = "События и встречи владельца экспортной ссылки")
@SecurityRequirement(name = "exportToken")
public class MyDataController {

    private final EventService eventService;
    private final AppointmentService appointmentService;
    private final EventMapper eventMapper;
    private final AppointmentMapper appointmentMapper;

    @GetMapping("/events")
    @Operation(summary = "Мои события")
    public Flux<EventDTO> myEvents() {
        return SecurityUtil.getCurrentOwnerId()
                .flatMapMany(eventService::listByOwner)
                .map(eventMapper::toDTO);
    }

    @GetMapping("/appointments")
    @Operation(summary = "Мои встречи")
    public Flux<AppointmentDTO> myAppointments() {
        return SecurityUtil.getCurrentOwnerId()
                .flatMapMany(appointmentService::findForIdentity)
                .map(appointmentMapper::toDTO);
    }
}
