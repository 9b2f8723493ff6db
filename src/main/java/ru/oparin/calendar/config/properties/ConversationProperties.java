package ru.oparin.calendar.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.conversation")
public class ConversationProperties {

    /**
     * Время бездействия, после которого незавершённый диалог сбрасывается.
     */
    private Duration sessionTtl = Duration.ofMinutes(30);

    /**
     * Максимальное число одновременно хранимых диалогов.
     */
    private long maxSessions = 100_000;
}
