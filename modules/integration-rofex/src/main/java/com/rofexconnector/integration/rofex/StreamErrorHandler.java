package com.rofexconnector.integration.rofex;

@FunctionalInterface
public interface StreamErrorHandler {
  void onError(StreamErrorMessage error);
}
