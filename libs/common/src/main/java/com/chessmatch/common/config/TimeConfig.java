/*
 * どこで: Common 共通設定
 * 何を: UTC の Clock を Bean として公開する
 * なぜ: 招待/対局の時刻をテストで固定できるようにするため
 */
package com.chessmatch.common.config;

import java.time.Clock;
import java.time.ZoneOffset;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  // TIMESTAMPTZ はマイクロ秒精度. ミリ秒刻みにして保存前後の Instant を一致させる
  @Bean
  public Clock clock() {
    return Clock.tickMillis(ZoneOffset.UTC);
  }
}
