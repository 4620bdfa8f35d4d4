package com.jobportal.api.security;

import com.jobportal.api.config.CorsProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.OrRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.List;

/**
 * Security configuration for the job portal API.
 *
 * Design principles:
 * - Stateless (bearer JWT only, no sessions)
 * - Fail-closed: anything not listed as public needs a valid token
 * - Role per route; ownership is checked by the services
 */
@Configuration
public class SecurityConfig {

    private final JsonSecurityErrorHandler errors;

    public SecurityConfig(JsonSecurityErrorHandler errors) {
        this.errors = errors;
    }

    /**
     * Public endpoints (no token processing at all):
     * - registration, login, token
     * - job browsing
     * - root health + error page
     */
    @Bean
    @Order(2)
    SecurityFilterChain publicApiChain(HttpSecurity http) throws Exception {
        RequestMatcher publicEndpoints = new OrRequestMatcher(
            ant(HttpMethod.GET, "/"),
            new AntPathRequestMatcher("/error"),
            ant(HttpMethod.POST, "/auth/register/**"),
            ant(HttpMethod.POST, "/auth/login"),
            ant(HttpMethod.POST, "/auth/token"),
            ant(HttpMethod.GET, "/jobs/**")
        );
        return http
            .securityMatcher(publicEndpoints)
            .cors(Customizer.withDefaults())
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
            .build();
    }

    /**
     * Secured API (JWT required) with the role each route demands.
     */
    @Bean
    @Order(3)
    SecurityFilterChain securedApiChain(HttpSecurity http, JwtDecoder jwtDecoder) throws Exception {
        return http
            .cors(Customizer.withDefaults())
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(ant(HttpMethod.OPTIONS, "/**")).permitAll()
                .requestMatchers(ant(HttpMethod.POST, "/jobs"), ant(HttpMethod.POST, "/jobs/")).hasRole("EMPLOYER")
                .requestMatchers(ant(HttpMethod.PUT, "/jobs/*"), ant(HttpMethod.DELETE, "/jobs/*")).hasRole("EMPLOYER")
                .requestMatchers(ant(HttpMethod.POST, "/applications"), ant(HttpMethod.POST, "/applications/")).hasRole("JOBSEEKER")
                .requestMatchers(ant(HttpMethod.GET, "/applications/my")).hasRole("JOBSEEKER")
                .requestMatchers(ant(HttpMethod.GET, "/applications/for-job/*")).hasRole("EMPLOYER")
                .requestMatchers(ant(HttpMethod.PUT, "/applications/*/review")).hasRole("EMPLOYER")
                .requestMatchers(new AntPathRequestMatcher("/dashboard/jobseeker")).hasRole("JOBSEEKER")
                .requestMatchers(new AntPathRequestMatcher("/dashboard/employer")).hasRole("EMPLOYER")
                .anyRequest().authenticated()
            )
            .oauth2ResourceServer(oauth -> oauth
                .jwt(jwt -> jwt.decoder(jwtDecoder).jwtAuthenticationConverter(new JwtRoleConverter()))
                .authenticationEntryPoint(errors)
                .accessDeniedHandler(errors)
            )
            .exceptionHandling(ex -> ex
                .authenticationEntryPoint(errors)
                .accessDeniedHandler(errors)
            )
            .build();
    }

    @Bean
    CorsConfigurationSource corsConfigurationSource(CorsProperties cors) {
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowedOriginPatterns(cors.allowedOrigins());
        config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
        config.setAllowedHeaders(List.of("*"));
        config.setExposedHeaders(List.of("X-Request-Id"));
        config.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);
        return source;
    }

    private static RequestMatcher ant(HttpMethod method, String pattern) {
        return new AntPathRequestMatcher(pattern, method.name());
    }
}
