package com.ecoWasteEngine.config;

import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.List;

/**
 * Stateless chain for the waste entry API. Every route is listed with its
 * method; anything else is denied. Per-resource ownership (own entries, own
 * reward state, assigned driver) is enforced in the services.
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

        private static final String API = "/api/v1";

        private final FirebaseTokenFilter firebaseTokenFilter;

        /**
         * Read from application.yml, override with env CORS_ALLOWED_ORIGINS on deploy
         */
        @Value("${cors.allowed-origins}")
        private List<String> allowedOrigins;

        @Bean
        public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
                http
                                .csrf(csrf -> csrf.disable())
                                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                                .sessionManagement(session -> session
                                                .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                                .exceptionHandling(errors -> errors.authenticationEntryPoint(unauthorized()))
                                .authorizeHttpRequests(auth -> auth
                                                .requestMatchers(HttpMethod.OPTIONS, API + "/**").permitAll()
                                                .requestMatchers(HttpMethod.GET, API + "/health").permitAll()

                                                // Submission and lookup of waste entries
                                                .requestMatchers(HttpMethod.POST, API + "/entries").authenticated()
                                                .requestMatchers(HttpMethod.GET, API + "/entries",
                                                                API + "/entries/*").authenticated()

                                                // Pickup requests, dispatch queue and state transitions
                                                .requestMatchers(HttpMethod.POST, API + "/pickups",
                                                                API + "/pickups/*/transition").authenticated()
                                                .requestMatchers(HttpMethod.GET, API + "/pickups",
                                                                API + "/pickups/*").authenticated()

                                                // Rewards
                                                .requestMatchers(HttpMethod.GET, API + "/users/*/reward-state",
                                                                API + "/users/*/reward-transactions",
                                                                API + "/users/*/achievements").authenticated()
                                                .requestMatchers(HttpMethod.GET, API + "/leaderboard").authenticated()

                                                .anyRequest().denyAll())
                                .addFilterBefore(firebaseTokenFilter, UsernamePasswordAuthenticationFilter.class);

                return http.build();
        }

        @Bean
        public CorsConfigurationSource corsConfigurationSource() {
                CorsConfiguration configuration = new CorsConfiguration();

                boolean hasWildcard = allowedOrigins != null
                                && allowedOrigins.stream().anyMatch("*"::equals);

                configuration.setAllowedOrigins(allowedOrigins);
                configuration.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
                configuration.setAllowedHeaders(List.of("Authorization", "Content-Type"));
                configuration.setAllowCredentials(!hasWildcard);
                configuration.setMaxAge(3600L);

                UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
                source.registerCorsConfiguration(API + "/**", configuration);
                return source;
        }

        /** Same body shape the token filter writes for a bad token */
        private AuthenticationEntryPoint unauthorized() {
                return (request, response, e) -> {
                        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
                        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
                        response.getWriter().write(
                                        "{\"error\": \"UNAUTHORIZED\", \"message\": \"A Firebase ID token is required\"}");
                };
        }
}
