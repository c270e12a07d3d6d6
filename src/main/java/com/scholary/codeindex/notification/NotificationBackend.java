package com.scholary.codeindex.notification;

/**
 * A sink for job lifecycle notifications (log, desktop, chat webhook, ...).
 *
 * <p>Delivery is fire-and-forget. Implementations may throw; the {@link NotificationDispatcher}
 * logs the failure and carries on delivering to the other backends.
 */
public interface NotificationBackend {

  /**
   * Deliver one notification.
   *
   * @param title short headline, e.g. "Indexing Complete: my-project"
   * @param message multi-line body
   * @param level severity
   */
  void notify(String title, String message, NotificationLevel level);
}
