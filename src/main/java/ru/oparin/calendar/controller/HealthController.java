package ru.oparin.calendar.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import ru.oparin.calendar.service.HealthService;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final HealthService healthService;

    public HealthController(HealthService healthService) {
        this.healthService = healthService;
    }

    @GetMapping
    public Mono<ResponseEntity<Map<String, Object>>> healthCheck() {
        return healthService.getDatabaseHealth()
                .map(databaseHealth -> {
                    Map<String, Object> health = new HashMap<>(healthService.getBasicHealth());
                    health.put("database", databaseHealth);

                    boolean healthy = "CONNECTED".equals(databaseHealth.get("status"));
                    if (!healthy) {
                        health.put("status", "DEGRADED");
                        log.warn("Проверка здоровья: база данных недоступна: {}", databaseHealth.get("error"));
                        return ResponseEntity.status(503).body(health);
                    }
                    return ResponseEntity.ok(health);
                });
    }
}
