package com.rofexconnector.worker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rofexconnector.integration.rofex.EnvironmentSettings;
import com.rofexconnector.integration.rofex.RofexConnector;
import com.rofexconnector.integration.rofex.RofexConnectorProperties;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RofexConnectorProperties.class)
public class RofexConnectorConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public EnvironmentSettings rofexEnvironmentSettings(RofexConnectorProperties properties) {
    if (properties.getEnvironment() == null) {
      throw new IllegalArgumentException("connector.rofex.environment is required");
    }
    EnvironmentSettings settings = EnvironmentSettings.defaults(properties.getEnvironment());
    URI restBaseUri =
        hasText(properties.getRestBaseUrl())
            ? URI.create(properties.getRestBaseUrl())
            : settings.restBaseUri();
    URI wsBaseUri =
        hasText(properties.getWsBaseUrl())
            ? URI.create(properties.getWsBaseUrl())
            : settings.wsBaseUri();
    settings =
        settings
            .withEndpoints(restBaseUri, wsBaseUri)
            .withTimeouts(
                Duration.ofMillis(properties.getHeartbeatIntervalMs()),
                Duration.ofMillis(properties.getConnectionTimeoutMs()),
                Duration.ofMillis(properties.getRequestTimeoutMs()));
    if (hasText(properties.getProprietary())) {
      settings = settings.withProprietary(properties.getProprietary());
    }
    return settings;
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "connector.rofex.stream", name = "enabled", havingValue = "true")
  public RofexCredentials rofexCredentials(RofexConnectorProperties properties) {
    return new RofexCredentials(
        properties.getUser(),
        resolveOptionalSecret(
            properties.getPassword(),
            properties.getPasswordFile(),
            "connector.rofex.password-file"),
        properties.getAccount(),
        resolveOptionalSecret(
            properties.getActiveToken(),
            properties.getActiveTokenFile(),
            "connector.rofex.active-token-file"));
  }

  @Bean
  @ConditionalOnMissingBean
  public RofexConnector rofexConnector(ObjectMapper objectMapper, MeterRegistry meterRegistry) {
    return new RofexConnector(objectMapper, meterRegistry);
  }

  private static String resolveOptionalSecret(String value, String filePath, String propertyName) {
    if (filePath == null || filePath.isBlank()) {
      return value;
    }
    try {
      String fromFile = Files.readString(Path.of(filePath), StandardCharsets.UTF_8).trim();
      return fromFile.isBlank() ? value : fromFile;
    } catch (IOException ex) {
      throw new IllegalArgumentException(propertyName + " cannot be read: " + filePath, ex);
    }
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
