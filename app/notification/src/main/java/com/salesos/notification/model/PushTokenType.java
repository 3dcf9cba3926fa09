package com.salesos.notification.model;

public enum PushTokenType {
  APNS,
  FCM
}
