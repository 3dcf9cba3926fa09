package com.salesos.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  /** Short id for correlating the log lines of one worker cycle. */
  public static String newCycleId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
