package ru.oparin.calendar.util;

import lombok.experimental.UtilityClass;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import reactor.core.publisher.Mono;

/**
 * Утилитный класс для работы с Spring Security.
 */
@UtilityClass
public class SecurityUtil {

    /**
     * ID владельца экспортной ссылки, по которой выполнен запрос.
     */
    public static Mono<Long> getCurrentOwnerId() {
        return ReactiveSecurityContextHolder.getContext()
                .map(SecurityContext::getAuthentication)
                .map(authentication -> (Long) authentication.getPrincipal());
    }
}
