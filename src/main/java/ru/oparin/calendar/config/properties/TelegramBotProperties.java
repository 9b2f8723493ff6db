package ru.oparin.calendar.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "telegram.bot")
public class TelegramBotProperties {

    /**
     * Токен бота от BotFather.
     */
    private String token;

    /**
     * Имя бота без @. Команды с суффиксом @имя другого бота не обрабатываются.
     */
    private String username;

    /**
     * Секрет webhook, который Telegram передаёт в заголовке X-Telegram-Bot-Api-Secret-Token.
     * Пустое значение отключает проверку.
     */
    private String webhookSecret;

    private String apiUrl = "https://api.telegram.org/bot";

    private Duration timeout = Duration.ofSeconds(30);
}
