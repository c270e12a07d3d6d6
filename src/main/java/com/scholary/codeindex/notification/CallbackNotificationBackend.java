package com.scholary.codeindex.notification;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards notifications to a caller-supplied callback, e.g. a UI progress bar or a test probe.
 *
 * <p>Exceptions thrown by the callback are logged here and not rethrown.
 */
public class CallbackNotificationBackend implements NotificationBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(CallbackNotificationBackend.class);

  /** Receives every notification delivered to this backend. */
  @FunctionalInterface
  public interface Callback {
    void accept(String title, String message, NotificationLevel level);
  }

  private final Callback callback;

  public CallbackNotificationBackend(Callback callback) {
    this.callback = Objects.requireNonNull(callback, "callback");
  }

  @Override
  public void notify(String title, String message, NotificationLevel level) {
    try {
      callback.accept(title, message, level);
    } catch (RuntimeException e) {
      LOGGER.error("Notification callback error: {}", e.getMessage(), e);
    }
  }
}
