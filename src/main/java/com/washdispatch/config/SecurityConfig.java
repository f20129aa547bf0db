package com.washdispatch.config;

import com.washdispatch.service.AccountUserDetailsService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.authentication.dao.DaoAuthenticationProvider;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;

@Configuration
@EnableMethodSecurity
public class SecurityConfig {

    private final AccountUserDetailsService userDetailsService;

    public SecurityConfig(AccountUserDetailsService userDetailsService) {
        this.userDetailsService = userDetailsService;
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public DaoAuthenticationProvider authenticationProvider() {
        DaoAuthenticationProvider provider = new DaoAuthenticationProvider();
        provider.setUserDetailsService(userDetailsService);
        provider.setPasswordEncoder(passwordEncoder());
        return provider;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                // JSON API only; the webhook is authenticated by its signature instead
                .csrf(AbstractHttpConfigurer::disable)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                .authorizeHttpRequests(auth -> auth
                        // Payment provider callbacks
                        .requestMatchers(HttpMethod.POST, "/api/payments/webhook").permitAll()

                        // Customer checkout and tracking
                        .requestMatchers(HttpMethod.POST, "/api/jobs", "/api/jobs/*/confirm-payment").permitAll()
                        .requestMatchers(HttpMethod.GET, "/api/jobs/*", "/api/customer/jobs").permitAll()
                        .requestMatchers("/ws", "/ws/**").permitAll()

                        // Operators
                        .requestMatchers("/api/admin/**").hasRole("ADMIN")

                        // Company admins
                        .requestMatchers("/api/company/**").hasRole("COMPANY_ADMIN")

                        // Cleaners
                        .requestMatchers("/api/cleaner/**").hasRole("CLEANER")
                        .requestMatchers(HttpMethod.POST, "/api/jobs/*/accept", "/api/jobs/*/start",
                                "/api/jobs/*/complete").hasRole("CLEANER")

                        .anyRequest().authenticated()
                )

                .httpBasic(Customizer.withDefaults());

        return http.build();
    }
}
