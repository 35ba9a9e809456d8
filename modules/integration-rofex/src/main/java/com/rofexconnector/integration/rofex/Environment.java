package com.rofexconnector.integration.rofex;

import java.net.URI;

public enum Environment {
  /** Demo environment used for testing. */
  REMARKET(
      URI.create("https://api.remarkets.primary.com.ar/"),
      URI.create("wss://api.remarkets.primary.com.ar/"),
      "PBCP"),
  /** Production environment. */
  LIVE(
      URI.create("https://api.primary.com.ar/"),
      URI.create("wss://api.primary.com.ar/"),
      "api");

  private final URI defaultRestBaseUri;
  private final URI defaultWsBaseUri;
  private final String defaultProprietary;

  Environment(URI defaultRestBaseUri, URI defaultWsBaseUri, String defaultProprietary) {
    this.defaultRestBaseUri = defaultRestBaseUri;
    this.defaultWsBaseUri = defaultWsBaseUri;
    this.defaultProprietary = defaultProprietary;
  }

  public URI defaultRestBaseUri() {
    return defaultRestBaseUri;
  }

  public URI defaultWsBaseUri() {
    return defaultWsBaseUri;
  }

  public String defaultProprietary() {
    return defaultProprietary;
  }
}
