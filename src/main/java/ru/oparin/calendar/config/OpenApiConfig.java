package ru.oparin.calendar.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.context.annotation.Configuration;

@OpenAPIDefinition(
        info = @Info(
                title = "Calendar Bot API",
                version = "1.0.0",
                description = "Выгрузка событий по подписанной ссылке, публичные события и данные владельца ссылки"
        ),
        servers = {
                @Server(url = "http://localhost:8080", description = "Локальный сервер")
        }
)
@SecurityScheme(name = "exportToken", type = SecuritySchemeType.HTTP, scheme = "bearer")
@Configuration
public class OpenApiConfig {
}
