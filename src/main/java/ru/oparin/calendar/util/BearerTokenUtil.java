package ru.oparin.calendar.util;

import lombok.experimental.UtilityClass;
import org.springframework.http.HttpHeaders;
import org.springframework.web.server.ServerWebExchange;

/**
 * Извлечение экспортного токена из запроса: параметр token или заголовок Authorization: Bearer.
 */
@UtilityClass
public class BearerTokenUtil {

    public static final String TOKEN_PARAM = "token";
    private static final String BEARER_PREFIX = "Bearer ";

    /**
     * @return токен или null, если он не передан
     */
    public static String extractToken(ServerWebExchange exchange) {
        String queryToken = exchange.getRequest().getQueryParams().getFirst(TOKEN_PARAM);
        if (queryToken != null && !queryToken.isBlank()) {
            return queryToken.trim();
        }
        String authHeader = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            return authHeader.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }
}
