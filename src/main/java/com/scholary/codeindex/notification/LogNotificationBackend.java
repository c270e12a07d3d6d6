package com.scholary.codeindex.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Writes notifications to the application log, mapping the level onto the log level. */
@Component
public class LogNotificationBackend implements NotificationBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(LogNotificationBackend.class);

  @Override
  public void notify(String title, String message, NotificationLevel level) {
    String line = title + ": " + message.replace('\n', ' ');
    if (level == NotificationLevel.ERROR) {
      LOGGER.error(line);
    } else if (level == NotificationLevel.WARNING) {
      LOGGER.warn(line);
    } else {
      LOGGER.info(line);
    }
  }
}
