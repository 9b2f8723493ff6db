package ru.oparin.calendar.service.conversation;

import java.util.Optional;

/**
 * Хранилище активных диалогов, не более одного на пользователя.
 */
public interface ConversationSessionStore {

    Optional<ConversationSession> get(Long userId);

    void put(ConversationSession session);

    /**
     * Удалить диалог пользователя.
     *
     * @return удалённый диалог или пустой результат, если диалога не было
     */
    Optional<ConversationSession> remove(Long userId);

    /**
     * Сбросить диалоги, истёкшие по бездействию.
     */
    void evictExpired();
}
