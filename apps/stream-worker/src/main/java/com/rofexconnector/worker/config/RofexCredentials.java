package com.rofexconnector.worker.config;

/** Login material for one environment. {@code activeToken}, when set, skips authentication. */
public record RofexCredentials(String user, String password, String account, String activeToken) {
  public RofexCredentials {
    user = blankToNull(user);
    password = blankToNull(password);
    account = blankToNull(account);
    activeToken = blankToNull(activeToken);
    if (activeToken == null && (user == null || password == null)) {
      throw new IllegalArgumentException(
          "connector.rofex.user and connector.rofex.password are required without an active token");
    }
  }

  @Override
  public String toString() {
    return "RofexCredentials[user=" + user + ", account=" + account + "]";
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
