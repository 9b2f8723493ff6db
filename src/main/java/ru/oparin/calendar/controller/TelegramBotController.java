package ru.oparin.calendar.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import ru.oparin.calendar.config.properties.TelegramBotProperties;
import ru.oparin.calendar.model.dto.telegram.TelegramUpdate;
import ru.oparin.calendar.service.telegram.TelegramBotService;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Контроллер для обработки webhook от Telegram Bot API.
 */
@RestController
@RequestMapping("/telegram")
@RequiredArgsConstructor
@Slf4j
public class TelegramBotController {

    static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

    private final TelegramBotService telegramBotService;
    private final TelegramBotProperties telegramBotProperties;

    /**
     * Обработка webhook от Telegram.
     * Ошибки обработки не возвращаются Telegram, иначе он будет повторять доставку обновления.
     *
     * @param update объект обновления от Telegram
     * @return статус обработки
     */
    @PostMapping("/webhook")
    public Mono<ResponseEntity<String>> handleWebhook(@RequestBody TelegramUpdate update,
                                                      @RequestHeader(name = SECRET_HEADER, required = false) String secret) {
        if (!isSecretValid(secret)) {
            log.warn("Webhook {} отклонён: неверный секрет", update.getUpdateId());
            return Mono.just(ResponseEntity.status(HttpStatus.FORBIDDEN).body("FORBIDDEN"));
        }
        log.info("Получен webhook от Telegram: {}", update.getUpdateId());

        return telegramBotService.processUpdate(update)
                .then(Mono.just(ResponseEntity.ok("OK")))
                .onErrorResume(error -> {
                    log.error("Ошибка обработки webhook: {}", error.getMessage(), error);
                    return Mono.just(ResponseEntity.ok("ERROR"));
                });
    }

    private boolean isSecretValid(String secret) {
        String expected = telegramBotProperties.getWebhookSecret();
        if (expected == null || expected.isBlank()) {
            return true;
        }
        return secret != null && MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), secret.getBytes(StandardCharsets.UTF_8));
    }
}
