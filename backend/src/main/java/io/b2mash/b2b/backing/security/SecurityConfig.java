package io.b2mash.b2b.backing.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Stateless JWT resource server. Orders may be placed anonymously (the buyer is then identified by
 * email); every other API call requires a bearer token.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private final ActorFilter actorFilter;
  private final RequestLoggingFilter requestLoggingFilter;

  public SecurityConfig(ActorFilter actorFilter, RequestLoggingFilter requestLoggingFilter) {
    this.actorFilter = actorFilter;
    this.requestLoggingFilter = requestLoggingFilter;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health", "/error")
                    .permitAll()
                    .requestMatchers(HttpMethod.POST, "/api/orders")
                    .permitAll()
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .oauth2ResourceServer(oauth2 -> oauth2.jwt(jwt -> {}))
        .addFilterAfter(actorFilter, BearerTokenAuthenticationFilter.class)
        .addFilterAfter(requestLoggingFilter, ActorFilter.class);

    return http.build();
  }
}
