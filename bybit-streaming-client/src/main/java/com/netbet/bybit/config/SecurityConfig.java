package com.netbet.bybit.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Guard for the admin surface.
 * - /orders/** (place, cancel, history, sync, balance) requires ROLE_ADMIN over HTTP Basic.
 * - POST/DELETE /tickers/{symbol} change public subscriptions and also require ROLE_ADMIN.
 * - GET /session/** and GET /tickers/** stay open for monitoring.
 * - Everything else is denied.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    static final String ADMIN_ROLE = "ADMIN";

    private final String adminUser;
    private final String adminPassword;

    public SecurityConfig(@Value("${bybit.admin-user:admin}") String adminUser,
                          @Value("${bybit.admin-password:changeme}") String adminPassword) {
        if (adminPassword == null || adminPassword.isBlank()) {
            throw new IllegalStateException("bybit.admin-password must not be blank");
        }
        this.adminUser = adminUser == null || adminUser.isBlank() ? "admin" : adminUser.trim();
        this.adminPassword = adminPassword;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/orders/**").hasRole(ADMIN_ROLE)
                        .requestMatchers(HttpMethod.POST, "/tickers/**").hasRole(ADMIN_ROLE)
                        .requestMatchers(HttpMethod.DELETE, "/tickers/**").hasRole(ADMIN_ROLE)
                        .requestMatchers(HttpMethod.GET, "/session", "/session/**", "/tickers", "/tickers/**").permitAll()
                        .requestMatchers("/error").permitAll()
                        .anyRequest().denyAll()
                )
                .httpBasic(basic -> {});
        return http.build();
    }

    /** Single operator account; credentials come from bybit.admin-user / bybit.admin-password. */
    @Bean
    public UserDetailsService userDetailsService(PasswordEncoder encoder) {
        UserDetails operator = User.withUsername(adminUser)
                .password(encoder.encode(adminPassword))
                .roles(ADMIN_ROLE)
                .build();
        return new InMemoryUserDetailsManager(operator);
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return PasswordEncoderFactories.createDelegatingPasswordEncoder();
    }
}
