package com.rofexconnector.integration.rofex;

import java.net.http.HttpClient;

public final class RofexHttpClients {
  private RofexHttpClients() {}

  public static HttpClient create(EnvironmentSettings settings) {
    HttpClient.Builder builder =
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(settings.connectionTimeout());
    if (settings.proxy() != null) {
      builder.proxy(settings.proxy());
    }
    if (settings.sslContext() != null) {
      builder.sslContext(settings.sslContext());
    }
    return builder.build();
  }
}
