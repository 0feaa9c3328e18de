package com.chessmatch.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  @Test
  void toTimestampKeepsInstant() {
    final Instant instant = Instant.parse("2026-03-01T10:15:30Z");

    assertThat(JdbcTimestampUtils.toTimestamp(instant).toInstant()).isEqualTo(instant);
  }

  @Test
  void toTimestampPassesNullThrough() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
  }
}
