package com.rofexconnector.integration.rofex;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HttpRofexAuthenticator implements RofexAuthenticator {
  private static final Logger log = LoggerFactory.getLogger(HttpRofexAuthenticator.class);

  static final String USERNAME_HEADER = "X-Username";
  static final String PASSWORD_HEADER = "X-Password";
  static final String TOKEN_HEADER = "X-Auth-Token";

  private final HttpClient httpClient;
  private final EnvironmentContext context;

  public HttpRofexAuthenticator(HttpClient httpClient, EnvironmentContext context) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    this.context = Objects.requireNonNull(context, "context is required");
  }

  @Override
  public void authenticate() {
    if (!hasText(context.user()) || !hasText(context.password())) {
      context.invalidate();
      throw new RofexAuthenticationException(
          "User and password are required to authenticate",
          RofexConnectorException.NO_HTTP_STATUS);
    }
    HttpRequest request =
        HttpRequest.newBuilder(context.settings().resolveRest(RofexRequestPaths.AUTH))
            .timeout(context.settings().requestTimeout())
            .header(USERNAME_HEADER, context.user())
            .header(PASSWORD_HEADER, context.password())
            .POST(HttpRequest.BodyPublishers.noBody())
            .build();
    HttpResponse<String> response = send(request);
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      context.invalidate();
      log.warn(
          "Authentication rejected environment={} user={} status={}",
          context.environment(),
          context.user(),
          response.statusCode());
      throw new RofexAuthenticationException(
          "Authentication fails. Incorrect User or Password", response.statusCode());
    }
    String token = response.headers().firstValue(TOKEN_HEADER).orElse(null);
    if (!hasText(token)) {
      context.invalidate();
      throw new RofexAuthenticationException(
          "Authentication response missing " + TOKEN_HEADER + " header", response.statusCode());
    }
    context.markAuthenticated(token);
    log.info("Authenticated environment={} user={}", context.environment(), context.user());
  }

  private HttpResponse<String> send(HttpRequest request) {
    try {
      return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new RofexConnectorException(
          "Authentication request was interrupted", RofexConnectorException.NO_HTTP_STATUS, ex);
    } catch (IOException ex) {
      throw new RofexConnectorException(
          "Failed to call authentication endpoint", RofexConnectorException.NO_HTTP_STATUS, ex);
    }
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
