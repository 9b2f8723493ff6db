package ru.oparin.calendar.scheduled;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import ru.oparin.calendar.service.conversation.ConversationSessionStore;

/**
 * Планировщик сброса диалогов, истёкших по бездействию.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationCleanupScheduler {

    private final ConversationSessionStore conversationSessionStore;

    /**
     * Caffeine удаляет истёкшие записи лениво, поэтому раз в минуту запускаем очистку явно.
     */
    @Scheduled(fixedDelayString = "${app.conversation.cleanup-interval:60000}")
    public void evictExpiredSessions() {
        try {
            conversationSessionStore.evictExpired();
        } catch (RuntimeException e) {
            log.error("Ошибка при очистке истёкших диалогов", e);
        }
    }
}
