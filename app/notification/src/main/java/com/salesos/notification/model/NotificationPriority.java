package com.salesos.notification.model;

public enum NotificationPriority {
  LOW,
  NORMAL,
  HIGH,
  URGENT
}
