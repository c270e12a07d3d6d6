package com.scholary.codeindex.notification;

/** Severity attached to a notification. Backends decide how to render it. */
public enum NotificationLevel {
  INFO,
  SUCCESS,
  WARNING,
  ERROR
}
