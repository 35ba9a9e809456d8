package com.rofexconnector.integration.rofex;

import java.net.ProxySelector;
import java.net.URI;
import java.time.Duration;
import javax.net.ssl.SSLContext;

public record EnvironmentSettings(
    Environment environment,
    URI restBaseUri,
    URI wsBaseUri,
    String proprietary,
    Duration heartbeatInterval,
    Duration connectionTimeout,
    Duration requestTimeout,
    ProxySelector proxy,
    SSLContext sslContext) {
  public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
  public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(5);
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

  public EnvironmentSettings {
    if (environment == null) {
      throw new IllegalArgumentException("environment is required");
    }
    if (restBaseUri == null) {
      throw new IllegalArgumentException("restBaseUri is required");
    }
    if (wsBaseUri == null) {
      throw new IllegalArgumentException("wsBaseUri is required");
    }
    if (proprietary == null || proprietary.isBlank()) {
      throw new IllegalArgumentException("proprietary is required");
    }
    requirePositive(heartbeatInterval, "heartbeatInterval");
    requirePositive(connectionTimeout, "connectionTimeout");
    requirePositive(requestTimeout, "requestTimeout");
    restBaseUri = withTrailingSlash(restBaseUri);
  }

  public static EnvironmentSettings defaults(Environment environment) {
    if (environment == null) {
      throw new IllegalArgumentException("environment is required");
    }
    return new EnvironmentSettings(
        environment,
        environment.defaultRestBaseUri(),
        environment.defaultWsBaseUri(),
        environment.defaultProprietary(),
        DEFAULT_HEARTBEAT_INTERVAL,
        DEFAULT_CONNECTION_TIMEOUT,
        DEFAULT_REQUEST_TIMEOUT,
        null,
        null);
  }

  public EnvironmentSettings withEndpoints(URI restBaseUri, URI wsBaseUri) {
    return new EnvironmentSettings(
        environment,
        restBaseUri,
        wsBaseUri,
        proprietary,
        heartbeatInterval,
        connectionTimeout,
        requestTimeout,
        proxy,
        sslContext);
  }

  public EnvironmentSettings withTimeouts(
      Duration heartbeatInterval, Duration connectionTimeout, Duration requestTimeout) {
    return new EnvironmentSettings(
        environment,
        restBaseUri,
        wsBaseUri,
        proprietary,
        heartbeatInterval,
        connectionTimeout,
        requestTimeout,
        proxy,
        sslContext);
  }

  public EnvironmentSettings withProxy(ProxySelector proxy) {
    return new EnvironmentSettings(
        environment,
        restBaseUri,
        wsBaseUri,
        proprietary,
        heartbeatInterval,
        connectionTimeout,
        requestTimeout,
        proxy,
        sslContext);
  }

  public EnvironmentSettings withSslContext(SSLContext sslContext) {
    return new EnvironmentSettings(
        environment,
        restBaseUri,
        wsBaseUri,
        proprietary,
        heartbeatInterval,
        connectionTimeout,
        requestTimeout,
        proxy,
        sslContext);
  }

  public EnvironmentSettings withProprietary(String proprietary) {
    return new EnvironmentSettings(
        environment,
        restBaseUri,
        wsBaseUri,
        proprietary,
        heartbeatInterval,
        connectionTimeout,
        requestTimeout,
        proxy,
        sslContext);
  }

  public URI resolveRest(String path) {
    return restBaseUri.resolve(path);
  }

  private static void requirePositive(Duration value, String name) {
    if (value == null || value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be > 0");
    }
  }

  // URI#resolve drops the last path segment of a base without a trailing slash.
  private static URI withTrailingSlash(URI uri) {
    String value = uri.toString();
    return value.endsWith("/") ? uri : URI.create(value + "/");
  }
}
