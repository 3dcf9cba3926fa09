package com.salesos.notification.service;

import java.util.UUID;

public class NotificationJobNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public NotificationJobNotFoundException(UUID jobId) {
    super("notification job not found id=" + jobId);
  }
}
