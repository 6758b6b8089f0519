package io.b2mash.timetracker.security;

import io.b2mash.timetracker.logging.RequestLoggingFilter;
import io.b2mash.timetracker.ratelimit.RateLimitFilter;
import java.util.List;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
@EnableWebSecurity
@EnableMethodSecurity
public class SecurityConfig {

  private final TokenAuthenticationConverter tokenAuthConverter;
  private final TokenAuthenticationEntryPoint tokenAuthEntryPoint;
  private final RequestLoggingFilter requestLoggingFilter;
  private final RateLimitFilter rateLimitFilter;
  private final Environment environment;

  public SecurityConfig(
      TokenAuthenticationConverter tokenAuthConverter,
      TokenAuthenticationEntryPoint tokenAuthEntryPoint,
      RequestLoggingFilter requestLoggingFilter,
      RateLimitFilter rateLimitFilter,
      Environment environment) {
    this.tokenAuthConverter = tokenAuthConverter;
    this.tokenAuthEntryPoint = tokenAuthEntryPoint;
    this.requestLoggingFilter = requestLoggingFilter;
    this.rateLimitFilter = rateLimitFilter;
    this.environment = environment;
  }

  /**
   * Bearer tokens on {@code /api/**}; token vending and health are public; everything else is
   * denied. Role checks live on the controllers.
   */
  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.cors(cors -> cors.configurationSource(corsConfigurationSource()))
        .csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(HttpMethod.GET, "/get-token")
                    .permitAll()
                    .requestMatchers("/actuator/health", "/actuator/health/**")
                    .permitAll()
                    .requestMatchers("/error")
                    .permitAll()
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .oauth2ResourceServer(
            oauth2 ->
                oauth2
                    .jwt(jwt -> jwt.jwtAuthenticationConverter(tokenAuthConverter))
                    .authenticationEntryPoint(tokenAuthEntryPoint))
        .exceptionHandling(exceptions -> exceptions.authenticationEntryPoint(tokenAuthEntryPoint))
        .addFilterAfter(requestLoggingFilter, BearerTokenAuthenticationFilter.class)
        .addFilterAfter(rateLimitFilter, RequestLoggingFilter.class);

    return http.build();
  }

  @Bean
  CorsConfigurationSource corsConfigurationSource() {
    List<String> origins =
        Binder.get(environment)
            .bind("cors.allowed-origins", Bindable.listOf(String.class))
            .orElse(List.of());

    var config = new CorsConfiguration();
    if (!origins.isEmpty()) {
      config.setAllowedOrigins(origins);
    }
    config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
    config.setAllowedHeaders(List.of("*"));
    config.setExposedHeaders(List.of("Location", "Retry-After"));
    config.setMaxAge(3600L);

    var source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", config);
    return source;
  }
}
