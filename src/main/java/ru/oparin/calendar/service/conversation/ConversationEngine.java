package ru.oparin.calendar.service.conversation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.calendar.exception.ConversationInputException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Пошаговые диалоги пользователей.
 * <p>
 * У пользователя не больше одного активного диалога. Ошибка разбора ввода не прерывает диалог:
 * шаг остаётся прежним и ввод можно повторить. Вызовы для одного пользователя должны быть
 * последовательными (см. {@link UserUpdateSerializer}).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationEngine {

    private static final Set<String> CANCEL_WORDS = Set.of("отмена", "/cancel");

    private final ConversationSessionStore sessionStore;
    private final Clock clock;

    public static boolean isCancelWord(String text) {
        return text != null && CANCEL_WORDS.contains(text.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Начать диалог с первого шага. Активный диалог пользователя, если он есть, заменяется.
     */
    public FlowStart startFlow(Long userId, FlowType flow) {
        if (flow == FlowType.NONE) {
            throw new IllegalArgumentException("Нельзя начать диалог типа NONE");
        }
        Optional<FlowType> replaced = sessionStore.remove(userId).map(ConversationSession::getFlow);
        replaced.ifPresent(old -> log.info("Пользователь {}: диалог {} заменён диалогом {}", userId, old, flow));

        ConversationSession session = new ConversationSession(userId, flow, clock.instant());
        sessionStore.put(session);
        log.info("Пользователь {}: начат диалог {}", userId, flow);
        return new FlowStart(session, replaced);
    }

    /**
     * Обработать ввод пользователя на текущем шаге без дополнительной проверки.
     */
    public SubmitResult submit(Long userId, String input) {
        Optional<ConversationSession> found = sessionStore.get(userId);
        if (found.isEmpty()) {
            return SubmitResult.noSession();
        }
        ConversationSession session = found.get();
        FlowStep step = session.currentStep();
        try {
            Object value = StepInputParser.parse(step.getInputType(), input);
            return commit(session, value);
        } catch (ConversationInputException e) {
            log.info("Пользователь {}: ввод на шаге {} диалога {} отклонён", userId, step, session.getFlow());
            return SubmitResult.failed(session.getFlow(), step, e.getMessage());
        }
    }

    /**
     * Обработать ввод с асинхронной проверкой значения (например, принадлежности события).
     * Отказ проверки даёт FAILED на том же шаге. Прочие ошибки проверки пробрасываются, диалог не меняется.
     */
    public Mono<SubmitResult> submit(Long userId, String input, StepValidator validator) {
        return Mono.defer(() -> {
            Optional<ConversationSession> found = sessionStore.get(userId);
            if (found.isEmpty()) {
                return Mono.just(SubmitResult.noSession());
            }
            ConversationSession session = found.get();
            FlowStep step = session.currentStep();
            Object value;
            try {
                value = StepInputParser.parse(step.getInputType(), input);
            } catch (ConversationInputException e) {
                log.info("Пользователь {}: ввод на шаге {} диалога {} отклонён", userId, step, session.getFlow());
                return Mono.just(SubmitResult.failed(session.getFlow(), step, e.getMessage()));
            }
            return validator.validate(session, step, value)
                    .then(Mono.fromCallable(() -> commit(session, value)))
                    .onErrorResume(ConversationInputException.class, e -> {
                        log.info("Пользователь {}: значение шага {} не прошло проверку: {}", userId, step, e.getMessage());
                        return Mono.just(SubmitResult.failed(session.getFlow(), step, e.getMessage()));
                    });
        });
    }

    /**
     * Сбросить диалог пользователя. Повторный вызов без диалога ничего не делает.
     *
     * @return true, если диалог был активен
     */
    public boolean cancel(Long userId) {
        Optional<ConversationSession> removed = sessionStore.remove(userId);
        removed.ifPresent(session -> log.info("Пользователь {}: диалог {} отменён на шаге {}",
                userId, session.getFlow(), session.getStep()));
        return removed.isPresent();
    }

    /**
     * Вернуть диалог в состояние до завершающего шага, если завершающее действие не удалось.
     */
    public void restore(ConversationSession snapshot) {
        sessionStore.put(snapshot.copy());
        log.info("Пользователь {}: диалог {} восстановлен на шаге {}",
                snapshot.getUserId(), snapshot.getFlow(), snapshot.currentStep());
    }

    public FlowType activeFlow(Long userId) {
        return sessionStore.get(userId).map(ConversationSession::getFlow).orElse(FlowType.NONE);
    }

    private SubmitResult commit(ConversationSession session, Object value) {
        ConversationSession before = session.copy();
        session.accept(value);
        if (session.isComplete()) {
            sessionStore.remove(session.getUserId());
            log.info("Пользователь {}: диалог {} завершён", session.getUserId(), session.getFlow());
            return SubmitResult.completed(session.getFlow(), new LinkedHashMap<>(session.getData()), before);
        }
        sessionStore.put(session);
        return SubmitResult.advanced(session.getFlow(), session.currentStep());
    }
}
