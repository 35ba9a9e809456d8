package com.rofexconnector.integration.rofex;

public interface RofexAuthenticator {
  /**
   * Exchanges the environment's user and password for a token and stores it in the environment
   * context.
   *
   * @throws RofexAuthenticationException when the credentials are rejected
   */
  void authenticate();
}
