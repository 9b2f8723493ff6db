package ru.oparin.calendar.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.calendar.config.properties.ExportProperties;
import ru.oparin.calendar.mapper.EventMapper;
import ru.oparin.calendar.model.dto.EventDTO;
import ru.oparin.calendar.model.dto.ExportLinksDTO;
import ru.oparin.calendar.model.enums.ExportFormat;

import java.nio.charset.Charset;
import java.util.List;

/**
 * Выгрузка событий владельца в JSON и CSV.
 */
@Service
@RequiredArgsConstructor
public class ExportService {

    /**
     * Кодировка CSV, которую Excel открывает без настройки.
     */
    public static final Charset CSV_CHARSET = Charset.forName("windows-1251");

    private static final String CSV_HEADER = "id;name;date;time;details;tg_user_id";

    private final EventService eventService;
    private final EventMapper eventMapper;
    private final ExportTokenService exportTokenService;
    private final ExportProperties exportProperties;

    public Mono<List<EventDTO>> exportEvents(Long ownerId) {
        return eventService.listByOwner(ownerId)
                .map(eventMapper::toDTO)
                .collectList();
    }

    public Mono<byte[]> exportCsv(Long ownerId) {
        return exportEvents(ownerId).map(events -> toCsv(events).getBytes(CSV_CHARSET));
    }

    /**
     * Выдать новый токен и собрать ссылки на оба формата.
     */
    public ExportLinksDTO issueLinks(Long ownerId) {
        String token = exportTokenService.issue(ownerId);
        return new ExportLinksDTO(link(ExportFormat.JSON, token), link(ExportFormat.CSV, token));
    }

    String toCsv(List<EventDTO> events) {
        StringBuilder csv = new StringBuilder(CSV_HEADER).append("\r\n");
        for (EventDTO event : events) {
            csv.append(event.getId()).append(';')
                    .append(escape(event.getName())).append(';')
                    .append(event.getDate()).append(';')
                    .append(event.getTime() == null ? "" : event.getTime().toString()).append(';')
                    .append(escape(event.getDetails())).append(';')
                    .append(event.getTgUserId())
                    .append("\r\n");
        }
        return csv.toString();
    }

    private String link(ExportFormat format, String token) {
        String base = exportProperties.getBaseUrl().replaceAll("/+$", "");
        return base + "/export/" + format.pathValue() + "?token=" + token;
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(";") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
