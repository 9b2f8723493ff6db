package ru.oparin.calendar.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.oparin.calendar.config.properties.ConversationProperties;
import ru.oparin.calendar.service.conversation.ConversationSession;

/**
 * Конфигурация кеширования для приложения.
 */
@Slf4j
@Configuration
public class CacheConfig {

    /**
     * Кеш активных диалогов. Истечение по бездействию и есть неявный таймаут диалога.
     */
    @Bean
    public Cache<Long, ConversationSession> conversationSessionCache(ConversationProperties properties) {
        return Caffeine.newBuilder()
                .maximumSize(properties.getMaxSessions())
                .expireAfterAccess(properties.getSessionTtl())
                .removalListener((Long userId, ConversationSession session, RemovalCause cause) -> {
                    if (cause == RemovalCause.EXPIRED && session != null) {
                        log.info("Диалог {} пользователя {} сброшен по таймауту на шаге {}",
                                session.getFlow(), userId, session.getStep());
                    }
                })
                .build();
    }
}
