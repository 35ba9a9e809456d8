package com.rofexconnector.integration.rofex;

/**
 * Sink for failures raised away from the caller's thread: transport errors, connection timeouts,
 * malformed frames and exceptions thrown by other handlers.
 */
@FunctionalInterface
public interface StreamExceptionHandler {
  void onException(Throwable error);
}
