package com.salesos.notification.model;

public enum DeviceType {
  MOBILE_IOS,
  MOBILE_ANDROID,
  DESKTOP,
  WEB
}
