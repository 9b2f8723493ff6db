package ru.oparin.calendar.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import ru.oparin.calendar.exception.UnsupportedExportFormatException;
import ru.oparin.calendar.model.enums.ExportFormat;
import ru.oparin.calendar.service.ExportService;
import ru.oparin.calendar.service.ExportTokenService;
import ru.oparin.calendar.util.BearerTokenUtil;

/**
 * Выгрузка событий по подписанной ссылке без входа в систему.
 */
@Slf4j
@RestController
@RequestMapping("/export")
@RequiredArgsConstructor
@Tag(name = "Выгрузка", description = "Выгрузка событий владельца по экспортной ссылке")
public class ExportController {

    private static final MediaType CSV_MEDIA_TYPE = new MediaType("text", "csv", ExportService.CSV_CHARSET);

    private final ExportTokenService exportTokenService;
    private final ExportService exportService;

    @GetMapping("/{format}")
    @Operation(summary = "Выгрузить события",
            description = "Токен передаётся параметром token или заголовком Authorization: Bearer")
    @ApiResponse(responseCode = "200", description = "События владельца ссылки")
    @ApiResponse(responseCode = "400", description = "Неизвестный формат")
    @ApiResponse(responseCode = "403", description = "Ссылка недействительна или истекла")
    public Mono<ResponseEntity<?>> export(@Parameter(description = "json или csv") @PathVariable String format,
                                          ServerWebExchange exchange) {
        return Mono.fromCallable(() -> exportTokenService.redeem(BearerTokenUtil.extractToken(exchange)))
                .flatMap(ownerId -> {
                    ExportFormat exportFormat = ExportFormat.fromPath(format)
                            .orElseThrow(() -> new UnsupportedExportFormatException(format));
                    log.info("Выгрузка событий пользователя {} в формате {}", ownerId, exportFormat);
                    return switch (exportFormat) {
                        case JSON -> exportService.exportEvents(ownerId)
                                .<ResponseEntity<?>>map(events -> ResponseEntity.ok()
                                        .contentType(MediaType.APPLICATION_JSON)
                                        .body(events));
                        case CSV -> exportService.exportCsv(ownerId)
                                .<ResponseEntity<?>>map(bytes -> ResponseEntity.ok()
                                        .contentType(CSV_MEDIA_TYPE)
                                        .header(HttpHeaders.CONTENT_DISPOSITION,
                                                ContentDisposition.attachment().filename("events.csv").build().toString())
                                        .body(bytes));
                    };
                });
    }
}
