package com.codeheadsystems.aegis.springboot.security;

import com.codeheadsystems.aegis.ratelimit.RateLimitPolicies;
import com.codeheadsystems.aegis.ratelimit.RateLimiter;
import com.codeheadsystems.aegis.server.manager.TwoFactorManager;
import com.codeheadsystems.aegis.springboot.ratelimit.RateLimitFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
public class AegisSecurityConfig {

  @Bean
  public SessionAuthenticationFilter sessionAuthenticationFilter(TwoFactorManager twoFactorManager) {
    return new SessionAuthenticationFilter(twoFactorManager);
  }

  @Bean
  public RateLimitFilter rateLimitFilter(RateLimiter rateLimiter, RateLimitPolicies rateLimitPolicies) {
    return new RateLimitFilter(rateLimiter, rateLimitPolicies);
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                 RateLimitFilter rateLimitFilter,
                                                 SessionAuthenticationFilter sessionFilter) throws Exception {
    http
        .csrf(csrf -> csrf.disable())
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth
            .requestMatchers("/2fa/**", "/actuator/health", "/error").permitAll()
            .anyRequest().authenticated())
        .exceptionHandling(ex -> ex
            .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
        .addFilterBefore(sessionFilter, UsernamePasswordAuthenticationFilter.class)
        .addFilterBefore(rateLimitFilter, SessionAuthenticationFilter.class);
    return http.build();
  }
}
