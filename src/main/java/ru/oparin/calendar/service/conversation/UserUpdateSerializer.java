package ru.oparin.calendar.service.conversation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Последовательная обработка обновлений одного пользователя.
 * Следующее обновление пользователя начинает обрабатываться только после завершения предыдущего,
 * обновления разных пользователей обрабатываются параллельно.
 */
@Slf4j
@Component
public class UserUpdateSerializer {

    private final ConcurrentHashMap<Long, Mono<Void>> tails = new ConcurrentHashMap<>();

    public <T> Mono<T> serialize(Long userId, Supplier<Mono<T>> task) {
        if (userId == null) {
            return Mono.defer(task);
        }
        return Mono.defer(() -> {
            Sinks.Empty<Void> done = Sinks.empty();
            Mono<Void> current = done.asMono();
            Mono<Void> previous = tails.put(userId, current);
            Mono<Void> waitPrevious = previous == null ? Mono.empty() : previous.onErrorResume(e -> Mono.empty());

            return waitPrevious
                    .then(Mono.defer(task))
                    .doFinally(signal -> {
                        tails.remove(userId, current);
                        done.tryEmitEmpty();
                    });
        });
    }

    int pendingUsers() {
        return tails.size();
    }
}
