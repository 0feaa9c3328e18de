/*
 * どこで: Arena アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: 認証/招待/対局 API を単一アプリとして起動するため
 */
package com.chessmatch.arena;

import com.chessmatch.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class ArenaApplication {

  public static void main(String[] args) {
    SpringApplication.run(ArenaApplication.class, args);
  }
}
