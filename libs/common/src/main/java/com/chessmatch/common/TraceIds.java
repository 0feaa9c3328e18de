package com.chessmatch.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** 呼び出し元が付与した ID が使えればそれを、なければ新規採番した ID を返す. */
  public static String orNew(String candidate) {
    if (candidate == null || candidate.isBlank() || candidate.length() > 128) {
      return newTraceId();
    }
    return candidate.trim();
  }
}
