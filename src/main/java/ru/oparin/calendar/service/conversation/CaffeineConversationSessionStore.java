package ru.oparin.calendar.service.conversation;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Хранилище диалогов в памяти процесса на Caffeine. Не переживает перезапуск.
 */
@Component
@RequiredArgsConstructor
public class CaffeineConversationSessionStore implements ConversationSessionStore {

    private final Cache<Long, ConversationSession> conversationSessionCache;

    @Override
    public Optional<ConversationSession> get(Long userId) {
        return Optional.ofNullable(conversationSessionCache.getIfPresent(userId));
    }

    @Override
    public void put(ConversationSession session) {
        conversationSessionCache.put(session.getUserId(), session);
    }

    @Override
    public Optional<ConversationSession> remove(Long userId) {
        return Optional.ofNullable(conversationSessionCache.asMap().remove(userId));
    }

    @Override
    public void evictExpired() {
        conversationSessionCache.cleanUp();
    }
}
