package ru.oparin.calendar.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.authentication.HttpStatusServerEntryPoint;
import org.springframework.security.web.server.context.NoOpServerSecurityContextRepository;
import ru.oparin.calendar.service.ExportTokenService;

@Configuration
@EnableWebFluxSecurity
public class SecurityConfig {

    private final ExportTokenService exportTokenService;

    public SecurityConfig(ExportTokenService exportTokenService) {
        this.exportTokenService = exportTokenService;
    }

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http) {
        return http
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .authorizeExchange(auth -> auth
                        .pathMatchers("/swagger-ui.html", "/swagger-ui/**", "/v3/api-docs/**", "/webjars/**").permitAll()
                        .pathMatchers("/api/health/**").permitAll()
                        .pathMatchers(HttpMethod.POST, "/telegram/webhook").permitAll()
                        .pathMatchers(HttpMethod.GET, "/export/**").permitAll()
                        .pathMatchers(HttpMethod.GET, "/api/public/**").permitAll()
                        .pathMatchers("/api/my/**").authenticated()
                        .anyExchange().denyAll()
                )
                .exceptionHandling(handling -> handling
                        .authenticationEntryPoint(new HttpStatusServerEntryPoint(HttpStatus.FORBIDDEN)))
                .securityContextRepository(NoOpServerSecurityContextRepository.getInstance())
                .addFilterAt(new ExportTokenAuthenticationFilter(exportTokenService), SecurityWebFiltersOrder.AUTHENTICATION)
                .build();
    }
}
