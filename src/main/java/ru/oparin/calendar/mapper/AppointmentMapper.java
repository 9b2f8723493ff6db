package ru.oparin.calendar.mapper;

import org.springframework.stereotype.Component;
import ru.oparin.calendar.model.dto.AppointmentDTO;
import ru.oparin.calendar.model.entity.Appointment;

@Component
public class AppointmentMapper {

    public AppointmentDTO toDTO(Appointment appointment) {
        return AppointmentDTO.builder()
                .id(appointment.getId())
                .eventId(appointment.getEventId())
                .organizerId(appointment.getOrganizerId())
                .participantId(appointment.getParticipantId())
                .date(appointment.getDate())
                .time(appointment.getTime())
                .details(appointment.getDetails())
                .status(appointment.getStatus())
                .createdAt(appointment.getCreatedAt())
                .build();
    }
}
