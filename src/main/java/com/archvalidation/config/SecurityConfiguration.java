package com.archvalidation.config;

import com.archvalidation.infrastructure.security.JwtAuthenticationFilter;
import com.archvalidation.infrastructure.security.JwtTokenVerifier;
import com.archvalidation.infrastructure.security.RestAuthenticationEntryPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.OrRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Spring Security configuration of the validation API.
 *
 * Security architecture:
 * - Stateless authentication with HS256 bearer tokens
 * - Tenant and role taken from verified claims only
 * - Role and tenant decisions made by the SecurityKernel in the services
 * - CSRF protection disabled (stateless API)
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfiguration {

    static final String[] PUBLIC_PATHS = {
        "/validation/health", "/validation/metrics",
        "/actuator/health", "/actuator/info",
        "/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html",
        "/error"
    };

    private final JwtTokenVerifier tokenVerifier;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            // Disable CSRF for stateless API
            .csrf(csrf -> csrf.disable())

            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            .authorizeHttpRequests(auth -> auth
                // Public endpoints (health checks, aggregate metrics, API docs)
                .requestMatchers(publicPaths()).permitAll()

                // Validation API requires a verified token
                .requestMatchers("/validation/**").authenticated()

                // All other requests denied by default
                .anyRequest().denyAll()
            )

            .exceptionHandling(exceptions -> exceptions.authenticationEntryPoint(authenticationEntryPoint))

            .addFilterBefore(new JwtAuthenticationFilter(tokenVerifier, authenticationEntryPoint, publicPaths()),
                UsernamePasswordAuthenticationFilter.class)

            .headers(headers -> headers
                .contentSecurityPolicy(csp ->
                    csp.policyDirectives("default-src 'self'; frame-ancestors 'none'")
                )
                .frameOptions(frame -> frame.deny())
                .httpStrictTransportSecurity(hsts -> hsts
                    .includeSubDomains(true)
                    .maxAgeInSeconds(31536000)
                )
            );

        return http.build();
    }

    private static RequestMatcher publicPaths() {
        return new OrRequestMatcher(Arrays.stream(PUBLIC_PATHS)
            .<RequestMatcher>map(AntPathRequestMatcher::antMatcher)
            .collect(Collectors.toList()));
    }
}
