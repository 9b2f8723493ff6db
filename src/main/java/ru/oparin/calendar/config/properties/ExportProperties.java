package ru.oparin.calendar.config.properties;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Getter
@Setter
@Validated
@Configuration
@ConfigurationProperties(prefix = "app.export")
public class ExportProperties {

    /**
     * Секрет для подписи экспортных ссылок. Задаётся только снаружи (переменная окружения).
     */
    @NotBlank
    private String secret;

    /**
     * Срок жизни экспортной ссылки. Число без единиц трактуется как секунды.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration maxAge = Duration.ofSeconds(900);

    /**
     * Внешний адрес сервиса, из которого строятся ссылки на выгрузку.
     */
    private String baseUrl = "http://localhost:8080";
}
