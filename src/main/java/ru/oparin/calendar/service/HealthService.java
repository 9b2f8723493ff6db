package ru.oparin.calendar.service;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Service
public class HealthService {

    private static final Duration DB_PROBE_TIMEOUT = Duration.ofSeconds(3);

    private final DatabaseClient databaseClient;

    public HealthService(DatabaseClient databaseClient) {
        this.databaseClient = databaseClient;
    }

    public Map<String, Object> getBasicHealth() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("timestamp", LocalDateTime.now());
        health.put("service", "calendar-bot");
        return health;
    }

    public Mono<Map<String, Object>> getDatabaseHealth() {
        Map<String, Object> health = new HashMap<>();

        return databaseClient.sql("SELECT 1")
                .fetch()
                .first()
                .timeout(DB_PROBE_TIMEOUT)
                .map(result -> {
                    health.put("status", "CONNECTED");
                    health.put("database", "PostgreSQL");
                    return health;
                })
                .onErrorResume(e -> {
                    health.put("status", "ERROR");
                    health.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                    health.put("database", "PostgreSQL");
                    return Mono.just(health);
                });
    }
}
