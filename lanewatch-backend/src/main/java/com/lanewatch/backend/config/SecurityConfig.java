package com.lanewatch.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.Arrays;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    static final String DASHBOARD_ROLE = "DASHBOARD";

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                // The tracker posts frames from a separate process with no session
                .csrf(csrf -> csrf.disable())
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.OPTIONS, "/api/traffic/**").permitAll()
                        .requestMatchers(HttpMethod.POST, "/api/traffic/frames").permitAll()
                        .requestMatchers(HttpMethod.GET, "/api/traffic/**").hasRole(DASHBOARD_ROLE)
                        .requestMatchers("/traffic-stream/**").hasRole(DASHBOARD_ROLE)
                        .anyRequest().authenticated()
                )
                .httpBasic(Customizer.withDefaults());

        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return PasswordEncoderFactories.createDelegatingPasswordEncoder();
    }

    /**
     * Single dashboard account from lanewatch.dashboard.*, normally fed by DASH_USER / DASH_PASS.
     */
    @Bean
    public UserDetailsService dashboardUsers(TrafficProperties properties, PasswordEncoder passwordEncoder) {
        TrafficProperties.Dashboard dashboard = properties.getDashboard();
        return new InMemoryUserDetailsManager(User.withUsername(dashboard.getUser())
                .password(passwordEncoder.encode(dashboard.getPassword()))
                .roles(DASHBOARD_ROLE)
                .build());
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOriginPatterns(Arrays.asList("*"));
        configuration.setAllowedMethods(Arrays.asList("GET", "POST", "OPTIONS"));
        configuration.setAllowedHeaders(Arrays.asList("*"));
        configuration.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/traffic/**", configuration);
        source.registerCorsConfiguration("/traffic-stream/**", configuration);
        return source;
    }
}
