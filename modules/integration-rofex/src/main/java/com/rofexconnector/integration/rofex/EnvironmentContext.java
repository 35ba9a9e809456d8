package com.rofexconnector.integration.rofex;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable authenticated identity of one environment, shared by the REST client, the authenticator
 * and the streaming session.
 *
 * <p>The environment counts as initialized exactly while a token is held, so the token and the
 * initialized flag can never disagree.
 */
public class EnvironmentContext {
  private final EnvironmentSettings settings;
  private final String user;
  private final String password;
  private final AtomicReference<String> token = new AtomicReference<>();
  private volatile String account;
  private volatile String proprietary;

  public EnvironmentContext(
      EnvironmentSettings settings, String user, String password, String account) {
    this.settings = Objects.requireNonNull(settings, "settings is required");
    this.user = user;
    this.password = password;
    this.account = blankToNull(account);
    this.proprietary = settings.proprietary();
  }

  public EnvironmentSettings settings() {
    return settings;
  }

  public Environment environment() {
    return settings.environment();
  }

  public String user() {
    return user;
  }

  public String password() {
    return password;
  }

  public Optional<String> token() {
    return Optional.ofNullable(token.get());
  }

  public String requireToken() {
    String current = token.get();
    if (current == null) {
      throw new RofexNotInitializedException("The Environment is not initialized.");
    }
    return current;
  }

  public boolean isInitialized() {
    return token.get() != null;
  }

  public void markAuthenticated(String newToken) {
    if (newToken == null || newToken.isBlank()) {
      throw new IllegalArgumentException("token must not be blank");
    }
    token.set(newToken);
  }

  public void invalidate() {
    token.set(null);
  }

  public Optional<String> account() {
    return Optional.ofNullable(account);
  }

  public void setAccount(String account) {
    this.account = blankToNull(account);
  }

  public String proprietary() {
    return proprietary;
  }

  public void setProprietary(String proprietary) {
    if (proprietary == null || proprietary.isBlank()) {
      throw new IllegalArgumentException("proprietary must not be blank");
    }
    this.proprietary = proprietary;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
