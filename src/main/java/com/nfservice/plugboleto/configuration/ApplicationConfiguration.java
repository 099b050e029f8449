package com.nfservice.plugboleto.configuration;

import com.nfservice.plugboleto.polling.Sleeper;
import com.nfservice.plugboleto.polling.ThreadSleeper;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Application-wide bean configuration.
 *
 * <p>Provides:
 * <ul>
 *   <li>{@link PlugBoletoProperties} built from the {@code plugboleto.*} properties</li>
 *   <li>{@link RestTemplate} with the configured connect/read timeouts</li>
 *   <li>{@link Clock} for request timing</li>
 *   <li>{@link Sleeper} used between polling attempts (replaced by a recording sleeper in
 *   tests)</li>
 * </ul>
 */
@Configuration
public class ApplicationConfiguration {

  @Bean
  public PlugBoletoProperties plugBoletoProperties(
      @Value("${plugboleto.cnpj-sh:}") String cnpjSh,
      @Value("${plugboleto.token-sh:}") String tokenSh,
      @Value("${plugboleto.cnpj-cedente:}") String cnpjCedente,
      @Value("${plugboleto.production:false}") boolean production,
      @Value("${plugboleto.base-url:}") String baseUrl,
      @Value("${plugboleto.connect-timeout-ms:10000}") long connectTimeoutMs,
      @Value("${plugboleto.read-timeout-ms:30000}") long readTimeoutMs) {
    return new PlugBoletoProperties(cnpjSh, tokenSh, cnpjCedente, production, baseUrl,
        Duration.ofMillis(connectTimeoutMs), Duration.ofMillis(readTimeoutMs));
  }

  @Bean
  public RestTemplate restTemplate(RestTemplateBuilder builder,
      PlugBoletoProperties properties) {
    return builder
        .setConnectTimeout(properties.getConnectTimeout())
        .setReadTimeout(properties.getReadTimeout())
        .build();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public Sleeper sleeper() {
    return new ThreadSleeper();
  }
}
