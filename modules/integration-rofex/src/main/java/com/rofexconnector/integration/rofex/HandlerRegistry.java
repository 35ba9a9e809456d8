package com.rofexconnector.integration.rofex;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Ordered set of callbacks. Iteration works on a snapshot, so handlers may be added or removed
 * from any thread, including from inside a callback, while frames are being dispatched.
 */
public class HandlerRegistry<H> {
  private final CopyOnWriteArrayList<H> handlers = new CopyOnWriteArrayList<>();

  /** Returns false when the handler was already registered. */
  public boolean add(H handler) {
    if (handler == null) {
      throw new IllegalArgumentException("handler is required");
    }
    return handlers.addIfAbsent(handler);
  }

  public boolean remove(H handler) {
    if (handler == null) {
      return false;
    }
    return handlers.remove(handler);
  }

  public boolean contains(H handler) {
    return handler != null && handlers.contains(handler);
  }

  public int size() {
    return handlers.size();
  }

  void forEach(Consumer<? super H> action) {
    for (H handler : handlers) {
      action.accept(handler);
    }
  }
}
