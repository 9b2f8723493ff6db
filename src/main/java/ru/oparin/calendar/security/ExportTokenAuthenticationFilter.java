package ru.oparin.calendar.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import ru.oparin.calendar.exception.InvalidExportTokenException;
import ru.oparin.calendar.service.ExportTokenService;
import ru.oparin.calendar.util.BearerTokenUtil;

import java.util.ArrayList;

/**
 * Аутентификация по экспортной ссылке: владелец токена становится principal запроса.
 * Недействительный токен просто не аутентифицирует запрос, отказ формирует цепочка безопасности.
 */
@Slf4j
public class ExportTokenAuthenticationFilter implements WebFilter {

    private final ExportTokenService exportTokenService;

    public ExportTokenAuthenticationFilter(ExportTokenService exportTokenService) {
        this.exportTokenService = exportTokenService;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String token = BearerTokenUtil.extractToken(exchange);
        if (token == null) {
            return chain.filter(exchange);
        }

        Long ownerId;
        try {
            ownerId = exportTokenService.redeem(token);
        } catch (InvalidExportTokenException e) {
            log.warn("Недействительный токен в запросе {}: {}", exchange.getRequest().getPath(), e.getReason());
            return chain.filter(exchange);
        }

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(ownerId, null, new ArrayList<>());
        SecurityContext securityContext = SecurityContextHolder.createEmptyContext();
        securityContext.setAuthentication(authentication);

        return chain.filter(exchange)
                .contextWrite(ReactiveSecurityContextHolder.withSecurityContext(Mono.just(securityContext)));
    }
}
